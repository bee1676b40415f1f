package com.vibecoding.versionchecker;

import io.github.cdimascio.dotenv.Dotenv;
import io.github.cdimascio.dotenv.DotenvException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class VersionCheckerApplication {

    private static final Logger log = LoggerFactory.getLogger(VersionCheckerApplication.class);

    public static void main(String[] args) {
        loadDotenv();
        SpringApplication.run(VersionCheckerApplication.class, args);
    }

    /**
     * .env 값을 시스템 프로퍼티로 등록 (application.yml 의 ${...} 치환용)
     * 이미 설정된 시스템 프로퍼티는 덮어쓰지 않는다.
     */
    static void loadDotenv() {
        try {
            Dotenv dotenv = Dotenv.configure().ignoreIfMissing().load();
            int loaded = 0;
            for (var entry : dotenv.entries(Dotenv.Filter.DECLARED_IN_ENV_FILE)) {
                if (System.getProperty(entry.getKey()) == null) {
                    System.setProperty(entry.getKey(), entry.getValue());
                    loaded++;
                }
            }
            log.debug("Loaded {} setting(s) from .env", loaded);
        } catch (DotenvException e) {
            log.warn("Ignoring unreadable .env file: {}", e.getMessage());
        }
    }
}
