package com.purchasingpower.entityrevert.config;

import com.purchasingpower.entityrevert.configuration.AppProperties;
import com.purchasingpower.entityrevert.exception.SchemaException;
import com.purchasingpower.entityrevert.service.Committer;
import com.purchasingpower.entityrevert.service.GitRepository;
import com.purchasingpower.entityrevert.service.impl.GitCommitter;
import com.purchasingpower.entityrevert.service.impl.JGitRepository;
import com.purchasingpower.entityrevert.service.schema.DbSchemaInfo;
import com.purchasingpower.entityrevert.storage.IniSerializer;
import com.purchasingpower.entityrevert.storage.StorageFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;

/**
 * Wires the Git work tree, the INI file store and the entity schema from {@code app.*} properties.
 */
@Slf4j
@Configuration
public class EntityStoreConfig {

    @Bean
    public DbSchemaInfo dbSchemaInfo(AppProperties appProperties, ResourceLoader resourceLoader) {
        String location = appProperties.getSchema().getLocation();
        Resource resource = resourceLoader.getResource(location);
        try (InputStream in = resource.getInputStream()) {
            return DbSchemaInfo.load(in);
        } catch (IOException e) {
            throw new SchemaException("Cannot open entity schema at " + location, e);
        }
    }

    @Bean
    public IniSerializer iniSerializer() {
        return new IniSerializer();
    }

    @Bean
    public StorageFactory storageFactory(AppProperties appProperties, DbSchemaInfo dbSchemaInfo, IniSerializer iniSerializer) {
        Path storageRoot = Path.of(appProperties.getRepositoryDir()).resolve(appProperties.getStorage().getRoot());
        log.info("Entity store at {}", storageRoot.toAbsolutePath());
        return new StorageFactory(storageRoot, dbSchemaInfo, iniSerializer);
    }

    @Bean
    public GitRepository gitRepository(AppProperties appProperties) {
        return new JGitRepository(new File(appProperties.getRepositoryDir()));
    }

    @Bean
    public Committer committer(AppProperties appProperties) {
        return new GitCommitter(
                new File(appProperties.getRepositoryDir()),
                appProperties.getGit().getAuthorName(),
                appProperties.getGit().getAuthorEmail());
    }
}
