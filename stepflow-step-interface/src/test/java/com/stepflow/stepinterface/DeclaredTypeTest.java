package com.stepflow.stepinterface;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DeclaredTypeTest {

    @Test
    void ofClass_mapsScalarsAnyAndNone() {
        assertEquals(new DeclaredType.Scalar(ScalarKind.INTEGER), DeclaredType.ofClass(int.class));
        assertEquals(new DeclaredType.Scalar(ScalarKind.INTEGER), DeclaredType.ofClass(Integer.class));
        assertEquals(new DeclaredType.Scalar(ScalarKind.STRING), DeclaredType.ofClass(String.class));
        assertSame(DeclaredType.ANY, DeclaredType.ofClass(Object.class));
        assertSame(DeclaredType.NONE, DeclaredType.ofClass(Void.class));
        assertEquals(new DeclaredType.Named(ArrayList.class), DeclaredType.ofClass(ArrayList.class));
    }

    @Test
    void union_flattensAndDeduplicatesInOrder() {
        DeclaredType inner = DeclaredType.unionOf(String.class, Integer.class);
        DeclaredType outer = DeclaredType.union(List.of(inner, DeclaredType.ofClass(Integer.class), DeclaredType.NONE));

        assertTrue(outer.isUnion());
        assertEquals(List.of(
                new DeclaredType.Scalar(ScalarKind.STRING),
                new DeclaredType.Scalar(ScalarKind.INTEGER),
                DeclaredType.NONE), outer.members());
        assertEquals("Union[STRING, INTEGER, None]", outer.describe());
    }

    @Test
    void union_collapsesSingleMemberAndAny() {
        assertEquals(new DeclaredType.Scalar(ScalarKind.LONG), DeclaredType.unionOf(Long.class, long.class));
        assertSame(DeclaredType.ANY, DeclaredType.unionOf(String.class, Object.class));
        assertThrows(IllegalArgumentException.class, () -> DeclaredType.union(List.of()));
    }

    @Test
    void isAssignable_followsWideningAndUnions() {
        DeclaredType integer = DeclaredType.ofClass(Integer.class);
        DeclaredType dbl = DeclaredType.ofClass(Double.class);
        DeclaredType optionalInt = DeclaredType.unionOf(Integer.class, Void.class);

        assertTrue(TypeCompatibility.isAssignable(dbl, integer));
        assertFalse(TypeCompatibility.isAssignable(integer, dbl));
        assertTrue(TypeCompatibility.isAssignable(optionalInt, integer));
        assertFalse(TypeCompatibility.isAssignable(integer, optionalInt));
        assertTrue(TypeCompatibility.isAssignable(DeclaredType.ofClass(Number.class), integer));
        assertTrue(TypeCompatibility.isAssignable(DeclaredType.ofClass(List.class), DeclaredType.ofClass(ArrayList.class)));
        assertTrue(TypeCompatibility.isAssignable(integer, DeclaredType.ANY));
    }
}
