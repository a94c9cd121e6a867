package com.gnovoa.gridiron.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gnovoa.gridiron.codec.JsonArrayVectorCodec;
import com.gnovoa.gridiron.codec.LengthPrefixedVectorCodec;
import com.gnovoa.gridiron.encode.GameContextEncoder;
import com.gnovoa.gridiron.encode.PlayStateEncoder;
import com.gnovoa.gridiron.encode.PlayerFeatureEncoder;
import com.gnovoa.gridiron.encode.RosterEncoder;
import com.gnovoa.gridiron.encode.TensorCompositor;
import com.gnovoa.gridiron.encode.TensorLayout;
import com.gnovoa.gridiron.io.RecordReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class EncoderWiring {

    private static final Logger log = LoggerFactory.getLogger(EncoderWiring.class);

    @Bean
    public TensorLayout tensorLayout(TensorProperties props) {
        TensorLayout layout = props.toLayout();
        log.info("Tensor layout: roster {}x{} = {}, game {}, play {}",
                layout.rosterSize(), layout.playerWidth(), layout.rosterWidth(),
                layout.gameWidth(), layout.playWidth());
        return layout;
    }

    @Bean
    public PlayerFeatureEncoder playerFeatureEncoder(TensorLayout layout) {
        return new PlayerFeatureEncoder(layout);
    }

    @Bean
    public RosterEncoder rosterEncoder(TensorLayout layout, PlayerFeatureEncoder players) {
        return new RosterEncoder(layout, players);
    }

    @Bean
    public GameContextEncoder gameContextEncoder() {
        return new GameContextEncoder();
    }

    @Bean
    public PlayStateEncoder playStateEncoder() {
        return new PlayStateEncoder();
    }

    @Bean
    public TensorCompositor tensorCompositor(TensorLayout layout) {
        return new TensorCompositor(layout);
    }

    @Bean
    public JsonArrayVectorCodec jsonArrayVectorCodec(ObjectMapper mapper) {
        return new JsonArrayVectorCodec(mapper);
    }

    @Bean
    public LengthPrefixedVectorCodec lengthPrefixedVectorCodec() {
        return new LengthPrefixedVectorCodec();
    }

    @Bean
    public RecordReader recordReader(ObjectMapper mapper) {
        return new RecordReader(mapper);
    }
}
