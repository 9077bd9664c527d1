package com.hdrmerge.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class AlignMethodTest {

    @Test
    void parsesNamesAndAliases() {
        assertEquals(AlignMethod.EXTERNAL, AlignMethod.parse(null));
        assertEquals(AlignMethod.EXTERNAL, AlignMethod.parse(" external "));
        assertEquals(AlignMethod.IN_PROCESS, AlignMethod.parse("in-process"));
        assertEquals(AlignMethod.IN_PROCESS, AlignMethod.parse("OpenCV"));
        assertEquals(AlignMethod.IN_PROCESS, AlignMethod.parse("mtb"));
    }

    @Test
    void unknownMethodIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> AlignMethod.parse("magic"));
    }
}
