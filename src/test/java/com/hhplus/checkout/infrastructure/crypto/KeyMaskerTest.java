package com.hhplus.checkout.infrastructure.crypto;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("KeyMasker 테스트")
class KeyMaskerTest {

    @Test
    @DisplayName("8자 이상은 앞 7자와 뒤 4자만 보인다")
    void testMask_Long() {
        assertEquals("sk_live...9xYz", KeyMasker.mask("sk_live_51Habcdefg9xYz"));
        assertEquals("abcdefg...bcde", KeyMasker.mask("abcdefgabcde"));
    }

    @Test
    @DisplayName("8자 미만은 전부 가린다")
    void testMask_Short() {
        assertEquals("****", KeyMasker.mask("sk_1234"));
    }

    @Test
    @DisplayName("값이 없으면 null")
    void testMask_Empty() {
        assertNull(KeyMasker.mask(null));
        assertNull(KeyMasker.mask(""));
    }
}
