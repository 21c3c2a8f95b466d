package com.retokenizer.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

import java.lang.reflect.Constructor;
import org.junit.jupiter.api.Test;

class ConstantsTest {

    @Test
    void testConstantValues() {
        assertEquals(4, Constants.TAB_DISPLAY_WIDTH);
        assertEquals("#", Constants.DEFAULT_COMMENT_MARKER);
        assertEquals(" \t", Constants.DEFAULT_WHITESPACE);
        assertEquals("{", Constants.DEFAULT_SCOPE_START);
        assertEquals("}", Constants.DEFAULT_SCOPE_END);
        assertEquals(16 * 1024 * 1024, Constants.MAX_INPUT_CHARS);
    }

    @Test
    void testPrivateConstructorReachableByReflection() throws Exception {
        Constructor<Constants> constructor = Constants.class.getDeclaredConstructor();
        constructor.setAccessible(true);

        Constants constantsInstance = constructor.newInstance();
        assertNotNull(constantsInstance);
    }
}
