package com.infrastructure.api.config;

import com.google.common.base.Splitter;
import com.infrastructure.api.service.ProfanityFilter;
import com.infrastructure.api.service.WordListProfanityFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.util.FileCopyUtils;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

@Configuration
public class ProfanityFilterConfig {

    private static final Logger logger = LoggerFactory.getLogger(ProfanityFilterConfig.class);

    @Value("${app.profanity.word-list:classpath:profanity/words.txt}")
    private String wordListLocation;

    @Value("${app.profanity.extra-words:}")
    private String extraWords;

    @Bean
    public ProfanityFilter profanityFilter(ResourceLoader resourceLoader) {
        List<String> words = new ArrayList<>(loadWordList(resourceLoader.getResource(wordListLocation)));
        Splitter.on(',').trimResults().omitEmptyStrings().split(extraWords).forEach(words::add);
        WordListProfanityFilter filter = new WordListProfanityFilter(words);
        logger.info("Profanity filter loaded {} words from {}", filter.size(), wordListLocation);
        return filter;
    }

    private List<String> loadWordList(Resource resource) {
        if (!resource.exists()) {
            logger.warn("Profanity word list {} not found; only extra words will be masked", wordListLocation);
            return List.of();
        }
        try (Reader reader = new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8)) {
            String content = FileCopyUtils.copyToString(reader);
            List<String> words = new ArrayList<>();
            for (String line : Splitter.onPattern("\\r?\\n").trimResults().omitEmptyStrings().split(content)) {
                if (!line.startsWith("#")) {
                    words.add(line);
                }
            }
            return words;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read profanity word list " + wordListLocation, e);
        }
    }
}
