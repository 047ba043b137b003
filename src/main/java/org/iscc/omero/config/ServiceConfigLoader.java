package org.iscc.omero.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.iscc.omero.exception.ConfigException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Merges configuration layers: command line over config file over environment over defaults.
 */
@ApplicationScoped
public class ServiceConfigLoader {

    private static final Logger LOG = Logger.getLogger(ServiceConfigLoader.class);

    private final ObjectMapper mapper;

    @Inject
    public ServiceConfigLoader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * @param base        defaults and environment
     * @param configFile  optional JSON file, may be null
     * @param commandLine command-line overrides
     * @throws ConfigException if the file cannot be read or the merged result is invalid
     */
    public ServiceConfig load(ServiceConfig.Builder base, Path configFile, ConfigOverrides commandLine) {
        if (configFile != null) {
            ConfigFile file = readFile(configFile);
            if (file.logFile() != null) {
                LOG.warnf("log_file in %s has no effect, configure quarkus.log.file.path instead", configFile);
            }
            file.toOverrides().applyTo(base);
            LOG.infof("Loaded configuration file %s", configFile);
        }
        commandLine.applyTo(base);
        return base.build();
    }

    ConfigFile readFile(Path configFile) {
        if (!Files.isRegularFile(configFile)) {
            throw new ConfigException("load_config", "Config file not found: " + configFile, null);
        }

        try {
            return mapper.readerFor(ConfigFile.class)
                    .with(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                    .readValue(configFile.toFile());
        } catch (IOException e) {
            throw new ConfigException("load_config",
                    "Invalid config file " + configFile + ": " + e.getMessage(), e);
        }
    }
}
