package com.example.groundedrag.infrastructure.config;

import com.example.groundedrag.domain.model.MemoryTarget;
import com.example.groundedrag.infrastructure.memory.MemoryFileStore;
import com.example.groundedrag.infrastructure.memory.MemoryRepository;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class MemoryStoreConfig {

    private static final Logger log = LoggerFactory.getLogger(MemoryStoreConfig.class);

    @Bean
    public MemoryRepository memoryRepository(
            @Value("${groundedrag.memory.user-path}") String userPath,
            @Value("${groundedrag.memory.company-path}") String companyPath
    ) {
        Path user = Path.of(userPath);
        Path company = Path.of(companyPath);
        log.info("event=memory_store_config user={} company={}", user.toAbsolutePath(), company.toAbsolutePath());

        return new MemoryRepository(
                new MemoryFileStore(MemoryTarget.USER, user),
                new MemoryFileStore(MemoryTarget.COMPANY, company)
        );
    }
}
