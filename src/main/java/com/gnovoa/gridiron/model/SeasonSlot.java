package com.gnovoa.gridiron.model;

/** The four named seasonal splits carried by a player record under {@code seasonal}. */
public enum SeasonSlot {
  LAST("last"),
  WORST("worst"),
  BEST("best"),
  AVERAGE("average");

  private final String key;

  SeasonSlot(String key) {
    this.key = key;
  }

  /** @return JSON key of this split inside the {@code seasonal} block */
  public String key() {
    return key;
  }
}
