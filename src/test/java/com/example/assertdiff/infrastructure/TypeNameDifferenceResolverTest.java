package com.example.assertdiff.infrastructure;

import com.example.assertdiff.domain.TypeNamePair;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

class TypeNameDifferenceResolverTest {

    private final TypeNameDifferenceResolver resolver = new TypeNameDifferenceResolver();

    @Test
    void distinctSimpleNamesAreUsedAsIs() {
        TypeNamePair names = resolver.resolve(4, 4L);

        assertEquals("Integer", names.expectedName());
        assertEquals("Long", names.actualName());
        assertEquals(" (Integer)", names.expectedLabel());
        assertEquals(" (Long)", names.actualLabel());
    }

    @Test
    void nestedClassesWithSameSimpleNameUseEnclosingClass() {
        TypeNamePair names = resolver.resolve(new First.Value(), new Second.Value());

        assertEquals("TypeNameDifferenceResolverTest.First.Value", names.expectedName());
        assertEquals("TypeNameDifferenceResolverTest.Second.Value", names.actualName());
    }

    @Test
    void samePackageRelativeNamesEscalateToQualifiedNames() {
        TypeNamePair names = resolver.resolve(new java.util.Date(0), new java.sql.Date(0));

        assertEquals("java.util.Date", names.expectedName());
        assertEquals("java.sql.Date", names.actualName());
    }

    @Test
    void arraysKeepTheirBrackets() {
        TypeNamePair names = resolver.resolve(new int[0], new Integer[0]);

        assertEquals("int[]", names.expectedName());
        assertEquals("Integer[]", names.actualName());
    }

    @Test
    void indistinguishableTypesFallBackToQualifiedNames() {
        TypeNamePair names = resolver.resolve(1, 2);

        assertEquals("java.lang.Integer", names.expectedName());
        assertEquals("java.lang.Integer", names.actualName());
        assertFalse(names.isDistinct());
    }

    static class First {
        static class Value {
            @Override
            public String toString() {
                return "value";
            }
        }
    }

    static class Second {
        static class Value {
            @Override
            public String toString() {
                return "value";
            }
        }
    }
}
