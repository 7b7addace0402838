package com.streamfirst.media.tiering.boot;

import com.streamfirst.media.tiering.adapters.memory.InMemoryMediaCatalogAdapter;
import com.streamfirst.media.tiering.adapters.memory.InMemoryProviderRegistry;
import com.streamfirst.media.tiering.adapters.memory.InMemorySubjectDirectoryAdapter;
import com.streamfirst.media.tiering.adapters.storage.fs.CacheProvider;
import com.streamfirst.media.tiering.adapters.storage.fs.LocalVolumeProvider;
import com.streamfirst.media.tiering.adapters.storage.s3.S3StorageProvider;
import com.streamfirst.media.tiering.application.AutoDestinationPolicy;
import com.streamfirst.media.tiering.application.ConsolidationService;
import com.streamfirst.media.tiering.application.RemoteVerificationService;
import com.streamfirst.media.tiering.application.StorageStatusService;
import com.streamfirst.media.tiering.application.TransferService;
import com.streamfirst.media.tiering.domain.StorageSettings;
import com.streamfirst.media.tiering.ports.MediaCatalogPort;
import com.streamfirst.media.tiering.ports.ProviderRegistryPort;
import com.streamfirst.media.tiering.ports.SubjectDirectoryPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Wires providers, registry and services. The catalog and subject directory default to the
 * in-memory adapters; a deployment supplies its own beans for the real tables.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(StorageProperties.class)
public class MediaTieringConfiguration {

    // --- Providers ---

    @Bean
    public StorageSettings storageSettings(StorageProperties properties) {
        StorageSettings settings = properties.toSettings();
        log.info("Storage settings: {}", settings);
        return settings;
    }

    @Bean
    public LocalVolumeProvider localVolumeProvider(StorageSettings settings) {
        return new LocalVolumeProvider(settings.getLocalRoot());
    }

    @Bean
    public CacheProvider cacheProvider(StorageSettings settings) {
        return new CacheProvider(settings.getCacheRoot());
    }

    @Bean
    public S3StorageProvider s3StorageProvider(StorageSettings settings) {
        return S3StorageProvider.fromSettings(settings);
    }

    @Bean
    public ProviderRegistryPort providerRegistry(StorageSettings settings, LocalVolumeProvider local,
                                                 CacheProvider cache, S3StorageProvider remote) {
        return new InMemoryProviderRegistry(settings, List.of(local, cache, remote));
    }

    // --- Catalog collaborators ---

    @Bean
    @ConditionalOnMissingBean(MediaCatalogPort.class)
    public MediaCatalogPort mediaCatalog() {
        log.warn("No catalog configured, using the in-memory catalog");
        return new InMemoryMediaCatalogAdapter();
    }

    @Bean
    @ConditionalOnMissingBean(SubjectDirectoryPort.class)
    public SubjectDirectoryPort subjectDirectory() {
        return new InMemorySubjectDirectoryAdapter();
    }

    // --- Application services ---

    @Bean(destroyMethod = "shutdown")
    public ExecutorService transferExecutor(StorageProperties properties) {
        return Executors.newFixedThreadPool(properties.getTransferThreads());
    }

    @Bean
    public AutoDestinationPolicy autoDestinationPolicy(ProviderRegistryPort registry) {
        return new AutoDestinationPolicy(registry);
    }

    @Bean
    public TransferService transferService(MediaCatalogPort catalog, ProviderRegistryPort registry,
                                           SubjectDirectoryPort subjects, AutoDestinationPolicy policy,
                                           ExecutorService transferExecutor) {
        return new TransferService(catalog, registry, subjects, policy, transferExecutor);
    }

    @Bean
    public ConsolidationService consolidationService(MediaCatalogPort catalog, ProviderRegistryPort registry,
                                                     SubjectDirectoryPort subjects) {
        return new ConsolidationService(catalog, registry, subjects);
    }

    @Bean
    public StorageStatusService storageStatusService(MediaCatalogPort catalog, ProviderRegistryPort registry,
                                                     AutoDestinationPolicy policy) {
        return new StorageStatusService(catalog, registry, policy);
    }

    @Bean
    public RemoteVerificationService remoteVerificationService(MediaCatalogPort catalog,
                                                               ProviderRegistryPort registry) {
        return new RemoteVerificationService(catalog, registry);
    }

    @Bean
    public VerificationRunner verificationRunner(RemoteVerificationService verificationService) {
        return new VerificationRunner(verificationService);
    }
}
