package com.xksgroup.downloadtracker.config;

import com.xksgroup.downloadtracker.model.download.Priority;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.ReadingConverter;
import org.springframework.data.mongodb.core.convert.MongoCustomConversions;

import java.util.List;

@Configuration
public class MongoConverters {

    @Bean
    public MongoCustomConversions customConversions() {
        return new MongoCustomConversions(List.of(new StringToPriorityConverter()));
    }

    /**
     * Priorities are written as enum names. Older documents hold the controller's
     * label ("High") or numeric code ("1"), both of which still read back.
     */
    @ReadingConverter
    static class StringToPriorityConverter implements Converter<String, Priority> {
        @Override
        public Priority convert(String source) {
            for (Priority priority : Priority.values()) {
                if (priority.name().equals(source)) {
                    return priority;
                }
            }
            return Priority.fromReported(source).orElse(null);
        }
    }
}
