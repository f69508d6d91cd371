package com.deepansh.tracer.persistence;

import com.deepansh.tracer.config.MongoConfig;
import com.deepansh.tracer.core.RunTracker;
import com.deepansh.tracer.model.Run;
import com.deepansh.tracer.model.Serialized;
import org.bson.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.mongodb.core.convert.MappingMongoConverter;
import org.springframework.data.mongodb.core.convert.MongoCustomConversions;
import org.springframework.data.mongodb.core.convert.NoOpDbRefResolver;
import org.springframework.data.mongodb.core.mapping.MongoMappingContext;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;

class TracedRunDocumentMappingTest {

    private final List<Run> persisted = new ArrayList<>();
    private MappingMongoConverter converter;

    @BeforeEach
    void setUp() {
        MongoCustomConversions conversions = new MongoCustomConversions(List.of());
        MongoMappingContext context = new MongoMappingContext();
        context.setSimpleTypeHolder(conversions.getSimpleTypeHolder());
        context.afterPropertiesSet();

        converter = new MappingMongoConverter(NoOpDbRefResolver.INSTANCE, context);
        converter.setCustomConversions(conversions);
        MongoConfig.applyMapKeyPolicy(converter);
        converter.afterPropertiesSet();
    }

    @Test
    void dottedPayloadKeys_writeAndReadBack() {
        RunTracker tracker = new RunTracker(run -> {
            persisted.add(run);
            return CompletableFuture.completedFuture(null);
        }, Clock.systemUTC());
        Serialized serialized = Serialized.builder()
                .id(List.of("langchain", "chains", "LLMChain"))
                .kwargs(Map.of("llm.model", "gpt-4"))
                .build();

        tracker.handleChainStart(serialized, Map.of("user.name", "bob"), "chain-1");
        tracker.handleChainEnd(Map.of("answer.text", "hi bob"), "chain-1").join();

        Document stored = new Document();
        converter.write(TracedRunDocument.from(persisted.get(0)), stored);

        Document run = stored.get("run", Document.class);
        assertThat(run.get("inputs", Document.class)).containsKey("user" + MongoConfig.MAP_KEY_DOT_REPLACEMENT + "name");

        TracedRunDocument read = converter.read(TracedRunDocument.class, stored);
        assertThat(read.getId()).isEqualTo("chain-1");
        assertThat(read.getRun().getInputs()).containsEntry("user.name", "bob");
        assertThat(read.getRun().getOutputs()).containsEntry("answer.text", "hi bob");
        assertThat(read.getRun().getSerialized().getKwargs()).containsEntry("llm.model", "gpt-4");
    }
}
