package com.nayem.revision.spring;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.nayem.revision.metadata.EntityDescriptor;
import com.nayem.revision.metadata.EntityDescriptorRegistry;
import com.nayem.revision.metadata.IdentityTracker;
import com.nayem.revision.session.InMemoryOperationSink;
import com.nayem.revision.session.LoggingOperationSink;
import com.nayem.revision.session.OperationSink;
import com.nayem.revision.session.RevisionEngine;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.util.List;

@AutoConfiguration
@ConditionalOnProperty(name = "revision.enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(RevisionProperties.class)
public class RevisionAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(RevisionAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public IdentityTracker revisionIdentityTracker() {
        return new IdentityTracker();
    }

    @Bean
    @ConditionalOnMissingBean
    public EntityDescriptorRegistry entityDescriptorRegistry(ObjectProvider<EntityDescriptor<?>> descriptors,
            RevisionProperties properties,
            IdentityTracker identities) {
        List<EntityDescriptor<?>> registered = descriptors.orderedStream().toList();
        log.info("Registering {} entity descriptors", registered.size());
        return new EntityDescriptorRegistry(registered, properties.getMetadataCacheSize(), identities);
    }

    @Bean
    @ConditionalOnMissingBean
    public OperationSink revisionOperationSink(RevisionProperties properties,
            ObjectProvider<ObjectMapper> objectMapperProvider) {
        if (properties.isLogOperations()) {
            ObjectMapper mapper = objectMapperProvider.getIfAvailable();
            if (mapper == null) {
                mapper = new ObjectMapper();
            }
            return new LoggingOperationSink(mapper);
        }
        log.warn("No OperationSink bean defined and revision.log-operations=false, "
                + "keeping operations in memory");
        return new InMemoryOperationSink();
    }

    @Bean
    @ConditionalOnMissingBean
    public RevisionEngine revisionEngine(EntityDescriptorRegistry registry,
            OperationSink sink,
            RevisionProperties properties,
            ObjectProvider<MeterRegistry> registryProvider) {
        return RevisionEngine.builder()
                .introspector(registry)
                .sink(sink)
                .metrics(registryProvider.getIfAvailable())
                .trackIdentities(properties.isTrackIdentities())
                .build();
    }
}
