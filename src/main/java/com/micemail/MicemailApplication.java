package com.micemail;

import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * micemail mail submission service
 *
 * HTTP front end for an authenticated SMTP relay
 * - Recipient syntax validation
 * - MyBatis + SQLite recipient store
 * - Jakarta Mail relay delivery with exponential-backoff retry
 * - Reactor (Reactive) background dispatch
 * - Prometheus metrics monitoring
 */
@SpringBootApplication
@MapperScan("com.micemail.mapper")
@EnableConfigurationProperties
public class MicemailApplication {

    public static void main(String[] args) {
        SpringApplication.run(MicemailApplication.class, args);
    }
}
