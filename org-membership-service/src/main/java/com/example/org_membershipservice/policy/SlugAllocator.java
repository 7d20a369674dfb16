package com.example.org_membershipservice.policy;

import com.example.org_membershipservice.config.OrgProperties;
import com.example.org_membershipservice.exception.ConflictException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.util.Locale;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Turns a unit name into a URL-safe slug and picks the first free variant.
 * "Ministério de Música" becomes "ministerio-de-musica", then "-2", "-3", ...
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SlugAllocator {

    static final String FALLBACK_SLUG = "unit";

    private static final Pattern DIACRITICS = Pattern.compile("\\p{M}+");
    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-z0-9]+");
    private static final Pattern EDGE_DASHES = Pattern.compile("^-+|-+$");

    private final OrgProperties orgProperties;

    public static String slugify(String name) {
        if (name == null) {
            return FALLBACK_SLUG;
        }
        String decomposed = Normalizer.normalize(name.trim(), Normalizer.Form.NFD);
        String ascii = DIACRITICS.matcher(decomposed).replaceAll("");
        String dashed = NON_ALPHANUMERIC.matcher(ascii.toLowerCase(Locale.ROOT)).replaceAll("-");
        String slug = EDGE_DASHES.matcher(dashed).replaceAll("");
        return slug.isEmpty() ? FALLBACK_SLUG : slug;
    }

    /**
     * @param isTaken lookup against persisted slugs
     * @throws ConflictException ALREADY_EXISTS when every attempt is taken
     */
    public String allocate(String name, Predicate<String> isTaken) {
        String base = slugify(name);
        if (!isTaken.test(base)) {
            return base;
        }
        for (int suffix = 2; suffix <= orgProperties.getSlugMaxAttempts(); suffix++) {
            String candidate = base + "-" + suffix;
            if (!isTaken.test(candidate)) {
                log.debug("Slug {} taken, allocated {}", base, candidate);
                return candidate;
            }
        }
        log.warn("Slug allocation exhausted for base={}", base);
        throw ConflictException.slugUnavailable(base);
    }
}
