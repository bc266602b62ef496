package com.example.musiclibrary;

import com.example.musiclibrary.common.config.AppDrProperties;
import com.example.musiclibrary.common.config.AppLibraryProperties;
import com.example.musiclibrary.common.config.AppSyncProperties;
import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@MapperScan("com.example.musiclibrary.infrastructure.persistence.mapper")
@EnableScheduling
@EnableConfigurationProperties({
        AppLibraryProperties.class,
        AppSyncProperties.class,
        AppDrProperties.class
})
public class MusicLibrarySyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(MusicLibrarySyncApplication.class, args);
    }
}
