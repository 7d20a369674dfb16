package com.example.org_membershipservice.policy;

import com.example.org_membershipservice.config.OrgProperties;
import com.example.org_membershipservice.exception.ConflictException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SlugAllocatorTest {

    private OrgProperties properties;
    private SlugAllocator allocator;

    @BeforeEach
    void setUp() {
        properties = new OrgProperties();
        allocator = new SlugAllocator(properties);
    }

    @Test
    void slugify_stripsAccentsAndPunctuation() {
        assertEquals("ministerio-de-musica", SlugAllocator.slugify("Ministério de Música"));
        assertEquals("setor-jovem-2024", SlugAllocator.slugify("  Setor   Jovem!! 2024 "));
        assertEquals("acolhida", SlugAllocator.slugify("--Acolhida--"));
    }

    @Test
    void slugify_fallsBackWhenNothingIsLeft() {
        assertEquals(SlugAllocator.FALLBACK_SLUG, SlugAllocator.slugify("!!!"));
        assertEquals(SlugAllocator.FALLBACK_SLUG, SlugAllocator.slugify(null));
    }

    @Test
    void allocate_returnsBaseWhenFree() {
        assertEquals("casais", allocator.allocate("Casais", slug -> false));
    }

    @Test
    void allocate_appendsFirstFreeSuffix() {
        Set<String> taken = new HashSet<>(Set.of("casais", "casais-2"));
        assertEquals("casais-3", allocator.allocate("Casais", taken::contains));
    }

    @Test
    void allocate_failsWhenAttemptsAreExhausted() {
        properties.setSlugMaxAttempts(3);

        ConflictException ex = assertThrows(ConflictException.class,
                () -> allocator.allocate("Casais", slug -> true));
        assertEquals("ALREADY_EXISTS", ex.getCode());
    }
}
