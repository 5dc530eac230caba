package com.example.assertdiff.infrastructure;

import com.example.assertdiff.domain.TypeNamePair;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Finds the shortest pair of type names that tells two values apart.
 */
public class TypeNameDifferenceResolver {
    private static final Logger log = LogManager.getLogger(TypeNameDifferenceResolver.class);

    private static final List<Function<Class<?>, String>> NAME_STEPS =
            List.of(
                    TypeNameDifferenceResolver::shortName,
                    TypeNameDifferenceResolver::nestedName,
                    TypeNameDifferenceResolver::qualifiedName);

    /**
     * Resolve names for the runtime types of two non-null values. Names escalate from the
     * simple name to the fully qualified one; if even those are equal they are returned as is.
     */
    public TypeNamePair resolve(Object expected, Object actual) {
        Objects.requireNonNull(expected, "expected");
        Objects.requireNonNull(actual, "actual");
        return resolve(expected.getClass(), actual.getClass());
    }

    public TypeNamePair resolve(Class<?> expectedType, Class<?> actualType) {
        for (Function<Class<?>, String> step : NAME_STEPS) {
            String expectedName = step.apply(expectedType);
            String actualName = step.apply(actualType);
            if (!expectedName.equals(actualName)) {
                return new TypeNamePair(expectedName, actualName);
            }
        }
        String qualified = qualifiedName(expectedType);
        log.debug("Types {} and {} share the qualified name {}", expectedType, actualType, qualified);
        return new TypeNamePair(qualified, qualifiedName(actualType));
    }

    static String shortName(Class<?> type) {
        String simpleName = type.getSimpleName();
        return simpleName.isEmpty() ? type.getName() : simpleName;
    }

    /**
     * Name relative to the package, so a nested class reads as {@code Outer.Inner}.
     */
    static String nestedName(Class<?> type) {
        if (type.isArray()) {
            return nestedName(type.getComponentType()) + "[]";
        }
        String name = type.getName();
        String packageName = type.getPackageName();
        if (!packageName.isEmpty() && name.startsWith(packageName + ".")) {
            name = name.substring(packageName.length() + 1);
        }
        return name.replace('$', '.');
    }

    static String qualifiedName(Class<?> type) {
        String canonical = type.getCanonicalName();
        return canonical != null ? canonical : type.getTypeName();
    }
}
