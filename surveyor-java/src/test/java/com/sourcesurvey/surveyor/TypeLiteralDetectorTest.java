package com.sourcesurvey.surveyor;

import com.sourcesurvey.surveyor.detect.ConstructorShorthandDetector;
import com.sourcesurvey.surveyor.detect.TypeLiteralDetector;
import com.sourcesurvey.surveyor.report.Aggregator;
import com.sourcesurvey.surveyor.report.Category;
import com.sourcesurvey.surveyor.report.EvidenceRecord;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class TypeLiteralDetectorTest {

    private static List<String> literals(String source) {
        Aggregator found = SourceFixtures.detect(source, new TypeLiteralDetector());
        return found.records(Category.TYPE_LITERAL).stream()
                .map(EvidenceRecord::rendered)
                .collect(Collectors.toList());
    }

    @Test
    void classLiteralOfDeclaredClassIsFound() {
        List<String> found = literals("""
                class Point { }
                class Sample {
                    Object type = Point.class;
                }
                """);

        assertEquals(List.of("Point.class"), found);
    }

    @Test
    void typeUsagesAreNotLiterals() {
        List<String> found = literals("""
                import java.util.List;
                class Point { }
                class Sample {
                    Point point;
                    List<Point> points;
                    Point make(Point other) { return new Point(); }
                }
                """);

        assertTrue(found.isEmpty(), "Expected no literals but got: " + found);
    }

    @Test
    void primitiveArrayAndVoidLiteralsAreIgnored() {
        List<String> found = literals("""
                class Point { }
                class Sample {
                    Object a = int.class;
                    Object b = Point[].class;
                    Object c = void.class;
                    Object d = String[][].class;
                }
                """);

        assertTrue(found.isEmpty(), "Expected no literals but got: " + found);
    }

    @Test
    void everyKindOfTypeDeclarationCounts() {
        List<String> found = literals("""
                import java.lang.annotation.Retention;
                import java.util.Map;
                enum Color { RED }
                interface Shape { }
                record Pair(int a, int b) { }
                class Sample {
                    Object[] types = { Color.class, Shape.class, Pair.class, Retention.class, Map.Entry.class };
                }
                """);

        assertEquals(List.of("Color.class", "Shape.class", "Pair.class", "Retention.class", "Map.Entry.class"), found);
    }

    @Test
    void literalsInAnnotationsAndAsLambdaBodiesCount() {
        List<String> found = literals("""
                import java.lang.annotation.Retention;
                import java.lang.annotation.RetentionPolicy;
                import java.util.function.Supplier;
                @Retention(RetentionPolicy.RUNTIME)
                @interface Handles { Class<?> value(); }
                @Handles(String.class)
                class Sample {
                    Supplier<Class<?>> s = () -> Integer.class;
                }
                """);

        assertEquals(List.of("String.class", "Integer.class"), found);
    }

    @Test
    void recordsLineOfEachLiteral() {
        Aggregator found = SourceFixtures.detect("""
                class Sample {
                    Object a = String.class;

                    Object b = Long.class;
                }
                """, new TypeLiteralDetector());

        List<EvidenceRecord> records = found.records(Category.TYPE_LITERAL);
        assertEquals(2, records.size());
        assertEquals(2, records.get(0).location().line());
        assertEquals(4, records.get(1).location().line());
        assertEquals("String.class at test/Sample.java:2 (offset " + records.get(0).location().offset() + ")",
                records.get(0).describe());
    }

    @Test
    void combinedWithShorthandDetectorInOnePass() {
        Aggregator found = SourceFixtures.detect("""
                import java.util.function.Supplier;
                class Sample {
                    Supplier<Class<?>> type = () -> Sample.class;
                    Supplier<StringBuilder> make = () -> new StringBuilder();
                }
                """, new TypeLiteralDetector(), new ConstructorShorthandDetector());

        assertEquals(1, found.count(Category.TYPE_LITERAL));
        assertEquals(1, found.count(Category.HIGH_CONFIDENCE_UNNAMED_TEAROFF));
    }
}
