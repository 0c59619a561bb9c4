package org.dbsync.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.dbsync.options.DbSyncOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;

import static org.dbsync.options.DbSyncOptions.Connection.key;

public class ConfigurationLoader {
    private static final Logger log = LoggerFactory.getLogger(ConfigurationLoader.class);

    private static final String CONFIG_FILE_NAME = DbSyncOptions.Profile.CONFIG_FILE;
    private static final String DEFAULT_PROFILE = DbSyncOptions.Profile.DEFAULT;
    private static final String PROFILE_ENV_VAR = DbSyncOptions.Profile.ENV_VAR;

    private final ObjectMapper yamlMapper;
    private final Path startDirectory;
    private final UnaryOperator<String> environment;

    public ConfigurationLoader() {
        this(Paths.get("").toAbsolutePath());
    }

    public ConfigurationLoader(Path startDirectory) {
        this(startDirectory, System::getenv);
    }

    ConfigurationLoader(Path startDirectory, UnaryOperator<String> environment) {
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
        this.startDirectory = startDirectory;
        this.environment = environment;
    }

    /**
     * 설정을 로드하고 지정된 프로파일을 적용
     *
     * 우선순위: CLI 프로파일 > 환경변수 > 기본값(dev)
     *
     * @param cliProfile CLI에서 지정된 프로파일 (null 가능)
     * @return {@link DbSyncOptions} 키로 된 설정 맵. 설정되지 않은 접속 값은 포함되지 않는다.
     */
    public Map<String, String> loadConfiguration(String cliProfile) {
        String activeProfile = resolveActiveProfile(cliProfile);

        Optional<DbSyncConfiguration> config = findAndLoadConfiguration();
        if (config.isEmpty()) {
            return createDefaultConfiguration();
        }

        return extractConfigurationForProfile(config.get(), activeProfile);
    }

    String resolveActiveProfile(String cliProfile) {
        if (cliProfile != null && !cliProfile.trim().isEmpty()) {
            return cliProfile;
        }

        String envProfile = environment.apply(PROFILE_ENV_VAR);
        if (envProfile != null && !envProfile.trim().isEmpty()) {
            return envProfile;
        }

        return DEFAULT_PROFILE;
    }

    /**
     * 시작 디렉토리부터 상위 디렉토리로 올라가며 dbsync.yaml을 찾습니다.
     */
    private Optional<DbSyncConfiguration> findAndLoadConfiguration() {
        Path currentDir = startDirectory;

        while (currentDir != null) {
            Path configFile = currentDir.resolve(CONFIG_FILE_NAME);
            if (Files.exists(configFile)) {
                try {
                    log.debug("Loading configuration from {}", configFile);
                    return Optional.of(yamlMapper.readValue(configFile.toFile(), DbSyncConfiguration.class));
                } catch (IOException e) {
                    log.warn("Failed to parse {}: {}", configFile, e.getMessage());
                    return Optional.empty();
                }
            }
            currentDir = currentDir.getParent();
        }

        return Optional.empty();
    }

    private Map<String, String> extractConfigurationForProfile(DbSyncConfiguration config, String profile) {
        var profileConfig = config.getProfiles().get(profile);
        if (profileConfig == null) {
            log.warn("Profile '{}' not found in configuration. Using defaults.", profile);
            return createDefaultConfiguration();
        }

        var configMap = new HashMap<>(createDefaultConfiguration());
        putConnection(configMap, DbSyncOptions.Connection.SOURCE, profileConfig.getSource());
        putConnection(configMap, DbSyncOptions.Connection.TARGET, profileConfig.getTarget());

        var output = profileConfig.getOutput();
        if (output != null) {
            putIfPresent(configMap, DbSyncOptions.Output.DIRECTORY_KEY, output.getDirectory());
            putIfPresent(configMap, DbSyncOptions.Output.BASE_FILENAME_KEY, output.getBaseFilename());
        }
        return configMap;
    }

    private void putConnection(Map<String, String> map, String side,
                               DbSyncConfiguration.DatabaseConfiguration db) {
        if (db == null) return;
        putIfPresent(map, key(side, DbSyncOptions.Connection.HOST), db.getHost());
        if (db.getPort() != null) {
            map.put(key(side, DbSyncOptions.Connection.PORT), String.valueOf(db.getPort()));
        }
        putIfPresent(map, key(side, DbSyncOptions.Connection.USERNAME), db.getUsername());
        putIfPresent(map, key(side, DbSyncOptions.Connection.PASSWORD), db.getPassword());
        putIfPresent(map, key(side, DbSyncOptions.Connection.DATABASE), db.getDatabase());
        putIfPresent(map, key(side, DbSyncOptions.Connection.URL), db.getUrl());
    }

    private static void putIfPresent(Map<String, String> map, String key, String value) {
        if (value != null && !value.isBlank()) {
            map.put(key, value);
        }
    }

    private Map<String, String> createDefaultConfiguration() {
        return Map.of(
                DbSyncOptions.Output.DIRECTORY_KEY, DbSyncOptions.Output.DIRECTORY_DEFAULT,
                DbSyncOptions.Output.BASE_FILENAME_KEY, DbSyncOptions.Output.BASE_FILENAME_DEFAULT
        );
    }
}
