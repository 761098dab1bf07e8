package com.stepflow.caching;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

class ClassFileSourceCodeReaderTest {

    public static class Nested {
    }

    @Test
    void read_returnsClassFileBytes() {
        byte[] bytes = new ClassFileSourceCodeReader().read(Nested.class);

        // class files start with 0xCAFEBABE
        assertEquals((byte) 0xCA, bytes[0]);
        assertEquals((byte) 0xFE, bytes[1]);
        assertEquals((byte) 0xBA, bytes[2]);
        assertEquals((byte) 0xBE, bytes[3]);
    }

    @Test
    void fromConfig_hashesDifferentClassesDifferently() {
        SourceCodeHasher hasher = SourceCodeHasher.fromConfig();

        assertEquals("SHA-256", hasher.getAlgorithm());
        assertNotEquals(hasher.hash(Nested.class), hasher.hash(ClassFileSourceCodeReaderTest.class));
    }
}
