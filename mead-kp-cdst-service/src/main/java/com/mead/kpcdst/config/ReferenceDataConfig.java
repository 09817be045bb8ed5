package com.mead.kpcdst.config;

import com.mead.kpcdst.model.ReferenceData;
import com.mead.kpcdst.repository.ReferenceDataRepository;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ReferenceDataConfig {

    @Bean
    public ReferenceData referenceData(ReferenceDataRepository repository) {
        return repository.load();
    }
}
