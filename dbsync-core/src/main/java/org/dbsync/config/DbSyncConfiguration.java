package org.dbsync.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.ToString;

import java.util.HashMap;
import java.util.Map;

@Data
public class DbSyncConfiguration {

    /**
     * 프로파일별 설정 맵
     */
    @JsonProperty("profiles")
    private Map<String, ProfileConfiguration> profiles = new HashMap<>();

    /**
     * 개별 프로파일 설정
     */
    @Data
    public static class ProfileConfiguration {

        /** 기준(원하는 상태) 데이터베이스 */
        @JsonProperty("source")
        private DatabaseConfiguration source;

        /** 변경 대상 데이터베이스 */
        @JsonProperty("target")
        private DatabaseConfiguration target;

        @JsonProperty("output")
        private OutputConfiguration output;
    }

    /**
     * 데이터베이스 접속 설정
     */
    @Data
    public static class DatabaseConfiguration {

        @JsonProperty("host")
        private String host;

        @JsonProperty("port")
        private Integer port;

        @JsonProperty("username")
        private String username;

        @ToString.Exclude
        @JsonProperty("password")
        private String password;

        @JsonProperty("database")
        private String database;

        /** 지정하면 host/port 대신 사용 */
        @JsonProperty("url")
        private String url;
    }

    /**
     * 출력 관련 설정
     */
    @Data
    public static class OutputConfiguration {

        @JsonProperty("directory")
        private String directory;

        @JsonProperty("baseFilename")
        private String baseFilename;
    }
}
