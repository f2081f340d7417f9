package com.syntaxprime.elephant.knowledge.personality;

import com.syntaxprime.elephant.config.ElephantProperties;
import com.syntaxprime.elephant.exception.ValidationException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Named scoring strategies looked up by personality id at call time.
 */
@Component
public class PersonalityRegistry {
    private static final Logger log = LoggerFactory.getLogger(PersonalityRegistry.class);
    private final Map<String, PersonalityScorer> scorers;

    public PersonalityRegistry(ElephantProperties properties) {
        Map<String, PersonalityScorer> built = new LinkedHashMap<>();
        properties.getKnowledge().getPersonalities().forEach((id, personality) -> {
            String key = normalize(id);
            built.put(key, new RuleTablePersonalityScorer(key, personality.getRules()));
        });
        this.scorers = Collections.unmodifiableMap(built);
        log.info("Personality registry initialized: {}", this.scorers.keySet());
    }

    public PersonalityScorer require(String personalityId) {
        if (personalityId == null || personalityId.isBlank()) {
            throw new ValidationException("Personality id is required");
        }
        PersonalityScorer scorer = this.scorers.get(normalize(personalityId));
        if (scorer == null) {
            throw new ValidationException("Unknown personality: " + personalityId);
        }
        return scorer;
    }

    public boolean contains(String personalityId) {
        return personalityId != null && this.scorers.containsKey(normalize(personalityId));
    }

    public Set<String> ids() {
        return this.scorers.keySet();
    }

    private static String normalize(String id) {
        return id.trim().toLowerCase(Locale.ROOT);
    }
}
