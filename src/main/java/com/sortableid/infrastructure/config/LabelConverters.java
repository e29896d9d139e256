package com.sortableid.infrastructure.config;

import com.sortableid.domain.model.SortableRate;
import com.sortableid.domain.model.TimeGranularity;
import org.springframework.boot.context.properties.ConfigurationPropertiesBinding;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.convert.converter.Converter;

import java.util.Arrays;

/**
 * Lets properties use either the enum constant or its label ({@code 100_per_microsecond}, {@code millisecond}).
 */
@Configuration
public class LabelConverters {

    @Bean
    @ConfigurationPropertiesBinding
    public Converter<String, SortableRate> sortableRateConverter() {
        return new Converter<>() {
            @Override
            public SortableRate convert(String source) {
                return SortableRate.fromLabel(source.trim())
                    .orElseThrow(() -> new IllegalArgumentException("Unknown rate '" + source + "', expected one of "
                        + Arrays.stream(SortableRate.values()).map(SortableRate::label).toList()));
            }
        };
    }

    @Bean
    @ConfigurationPropertiesBinding
    public Converter<String, TimeGranularity> timeGranularityConverter() {
        return new Converter<>() {
            @Override
            public TimeGranularity convert(String source) {
                return TimeGranularity.fromLabel(source.trim())
                    .orElseThrow(() -> new IllegalArgumentException("Unknown granularity '" + source + "', expected one of "
                        + Arrays.stream(TimeGranularity.values()).map(TimeGranularity::label).toList()));
            }
        };
    }
}
