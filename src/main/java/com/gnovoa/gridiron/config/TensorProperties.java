package com.gnovoa.gridiron.config;

import com.gnovoa.gridiron.encode.TensorLayout;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "tensors")
public record TensorProperties(Integer rosterSize, Integer playerFeatureWidth, Categorical categorical) {
  public TensorProperties {
    if (rosterSize == null) rosterSize = TensorLayout.DEFAULT_ROSTER_SIZE;
    if (playerFeatureWidth == null) playerFeatureWidth = TensorLayout.DEFAULT_PLAYER_WIDTH;
    if (categorical == null) categorical = new Categorical(null, null);
  }

  public record Categorical(Integer identityModulus, Integer teamModulus) {
    public Categorical {
      if (identityModulus == null) identityModulus = TensorLayout.DEFAULT_IDENTITY_MODULUS;
      if (teamModulus == null) teamModulus = TensorLayout.DEFAULT_TEAM_MODULUS;
    }
  }

  /**
   * @return validated layout
   * @throws IllegalArgumentException if the configured sizes are invalid
   */
  public TensorLayout toLayout() {
    return new TensorLayout(
        rosterSize, playerFeatureWidth, categorical.identityModulus(), categorical.teamModulus());
  }
}
