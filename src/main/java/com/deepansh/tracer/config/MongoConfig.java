package com.deepansh.tracer.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.MongoDatabaseFactory;
import org.springframework.data.mongodb.config.EnableMongoAuditing;
import org.springframework.data.mongodb.core.convert.DefaultDbRefResolver;
import org.springframework.data.mongodb.core.convert.MappingMongoConverter;
import org.springframework.data.mongodb.core.convert.MongoCustomConversions;
import org.springframework.data.mongodb.core.mapping.MongoMappingContext;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;

/**
 * Enable MongoDB auditing so @CreatedDate on stored run trees
 * is populated on save.
 *
 * Run inputs, outputs, kwargs and extra are caller-supplied maps whose keys
 * may contain dots, which Mongo field names cannot. Dots are stored as
 * {@link #MAP_KEY_DOT_REPLACEMENT} and restored on read.
 */
@Configuration
@EnableMongoAuditing
@EnableMongoRepositories(basePackages = "com.deepansh.tracer.persistence")
public class MongoConfig {

    /** Fullwidth full stop; never produced by the ASCII keys callers normally use */
    public static final String MAP_KEY_DOT_REPLACEMENT = "\uFF0E";

    @Bean
    public MappingMongoConverter mappingMongoConverter(MongoDatabaseFactory factory,
                                                       MongoMappingContext context,
                                                       MongoCustomConversions conversions) {
        MappingMongoConverter converter = new MappingMongoConverter(new DefaultDbRefResolver(factory), context);
        converter.setCustomConversions(conversions);
        converter.setCodecRegistryProvider(factory);
        return applyMapKeyPolicy(converter);
    }

    public static MappingMongoConverter applyMapKeyPolicy(MappingMongoConverter converter) {
        converter.setMapKeyDotReplacement(MAP_KEY_DOT_REPLACEMENT);
        return converter;
    }
}
