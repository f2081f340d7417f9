package com.syntaxprime.elephant.config;

import com.syntaxprime.elephant.model.MessageRole;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.ReadingConverter;
import org.springframework.data.convert.WritingConverter;
import org.springframework.data.mongodb.core.convert.MongoCustomConversions;

/**
 * Stores message roles by their lowercase wire name ("user", "assistant").
 */
@Configuration
public class MongoConversionConfig {
    @Bean
    public MongoCustomConversions mongoCustomConversions() {
        return new MongoCustomConversions(List.of(new MessageRoleReadingConverter(), new MessageRoleWritingConverter()));
    }

    @ReadingConverter
    static final class MessageRoleReadingConverter implements Converter<String, MessageRole> {
        private static final Logger log = LoggerFactory.getLogger(MessageRoleReadingConverter.class);

        @Override
        public MessageRole convert(String source) {
            if (source == null || source.isBlank()) {
                return null;
            }
            for (MessageRole role : MessageRole.values()) {
                if (role.wireName().equalsIgnoreCase(source) || role.name().equals(source)) {
                    return role;
                }
            }
            log.warn("Ignoring unknown message role value '{}' from persisted message", source);
            return null;
        }
    }

    @WritingConverter
    static final class MessageRoleWritingConverter implements Converter<MessageRole, String> {
        @Override
        public String convert(MessageRole source) {
            return source == null ? null : source.wireName();
        }
    }
}
