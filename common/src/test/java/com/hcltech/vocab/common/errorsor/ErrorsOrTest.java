package com.hcltech.vocab.common.errorsor;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ErrorsOrTest {

    @Nested
    class ConstructionAndPredicates {
        @Test
        void liftCreatesValue() {
            ErrorsOr<Integer> eo = ErrorsOr.lift(42);
            assertTrue(eo.isValue());
            assertFalse(eo.isError());
            assertEquals(Optional.of(42), eo.getValue());
            assertTrue(eo.getErrors().isEmpty());
        }

        @Test
        void errorCreatesError() {
            ErrorsOr<String> eo = ErrorsOr.error("boom");
            assertTrue(eo.isError());
            assertFalse(eo.isValue());
            assertEquals(List.of("boom"), eo.getErrors());
            assertEquals(Optional.empty(), eo.getValue());
        }

        @Test
        void errorsFactoryRejectsEmptyList() {
            assertThrows(IllegalArgumentException.class, () -> ErrorsOr.errors(List.of()));
        }

        @Test
        void liftRejectsNull() {
            assertThrows(NullPointerException.class, () -> ErrorsOr.lift(null));
        }
    }

    @Nested
    class Extractors {
        @Test
        void valueOrThrowOnErrorThrows() {
            ErrorsOr<String> eo = ErrorsOr.error("nope");
            IllegalStateException ex = assertThrows(IllegalStateException.class, eo::valueOrThrow);
            assertTrue(ex.getMessage().contains("nope"));
        }

        @Test
        void errorsOrThrowOnValueThrows() {
            ErrorsOr<Integer> eo = ErrorsOr.lift(7);
            IllegalStateException ex = assertThrows(IllegalStateException.class, eo::errorsOrThrow);
            assertTrue(ex.getMessage().contains("7"));
        }

        @Test
        void valueOrDefault() {
            assertEquals("present", ErrorsOr.lift("present").valueOrDefault("fallback"));
            assertEquals("fallback", ErrorsOr.<String>error("x").valueOrDefault("fallback"));
        }

        @Test
        void foldPicksTheMatchingBranch() {
            assertEquals("v:1", ErrorsOr.lift(1).fold(v -> "v:" + v, es -> "e:" + es));
            assertEquals("e:[a]", ErrorsOr.<Integer>error("a").fold(v -> "v:" + v, es -> "e:" + es));
        }
    }

    @Nested
    class Combinators {
        @Test
        void mapAndFlatMapShortCircuitOnError() {
            ErrorsOr<Integer> err = ErrorsOr.errors(List.of("x", "y"));
            assertEquals(List.of("x", "y"), err.map(i -> i + 1).getErrors());
            assertEquals(List.of("x", "y"), err.flatMap(i -> ErrorsOr.lift(i + 1)).getErrors());
        }

        @Test
        void flatMapChainsValues() {
            assertEquals(Optional.of(3), ErrorsOr.lift(1).flatMap(i -> ErrorsOr.lift(i + 2)).getValue());
        }

        @Test
        void addPrefixIfErrorOnlyTouchesErrors() {
            assertEquals(List.of("ctx: a"), ErrorsOr.error("a").addPrefixIfError("ctx: ").getErrors());
            assertEquals(ErrorsOr.lift(1), ErrorsOr.lift(1).addPrefixIfError("ctx: "));
        }

        @Test
        void ifErrorRunsOnlyForErrors() {
            List<String> seen = new ArrayList<>();
            ErrorsOr.lift(1).ifError(seen::addAll);
            ErrorsOr.error("bad").ifError(seen::addAll);
            assertEquals(List.of("bad"), seen);
        }
    }

    @Nested
    class Trying {
        @Test
        void tryingCapturesMessage() {
            ErrorsOr<String> eo = ErrorsOr.trying(() -> {
                throw new IOException("disk gone");
            });
            assertEquals(List.of("disk gone"), eo.getErrors());
        }

        @Test
        void tryingFallsBackToClassName() {
            ErrorsOr<String> eo = ErrorsOr.trying(() -> {
                throw new IllegalStateException();
            });
            assertEquals(List.of("IllegalStateException"), eo.getErrors());
        }

        @Test
        void tryingWithFormatter() {
            ErrorsOr<String> eo = ErrorsOr.trying(() -> {
                throw new IllegalArgumentException("x");
            }, e -> "custom " + e.getMessage());
            assertEquals(List.of("custom x"), eo.getErrors());
        }

        @Test
        void mapTryTurnsExceptionsIntoErrors() {
            ErrorsOr<Integer> eo = ErrorsOr.lift("abc").mapTry(Integer::parseInt);
            assertTrue(eo.isError());
            assertTrue(eo.getErrors().get(0).contains("abc"));
            assertEquals(Optional.of(12), ErrorsOr.lift("12").mapTry(Integer::parseInt).getValue());
        }
    }
}
