package com.ryuqq.cutover.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ExpectedVersion 및 VersionToken 테스트.
 *
 * @author Cutover Team
 * @since 1.0.0
 */
class ExpectedVersionTest {

    private final VersionToken v1 = VersionToken.of("v1");
    private final VersionToken v2 = VersionToken.of("v2");

    @Test
    void any_IsSatisfiedByEveryState() {
        assertTrue(ExpectedVersion.any().isSatisfiedBy(null));
        assertTrue(ExpectedVersion.any().isSatisfiedBy(v1));
        assertTrue(ExpectedVersion.any().isUnconditional());
    }

    @Test
    void absent_IsSatisfiedOnlyWhenKeyMissing() {
        assertTrue(ExpectedVersion.absent().isSatisfiedBy(null));
        assertFalse(ExpectedVersion.absent().isSatisfiedBy(v1));
    }

    @Test
    void matching_IsSatisfiedOnlyByEqualToken() {
        // Given
        ExpectedVersion expected = ExpectedVersion.matching(v1);

        // Then
        assertTrue(expected.isSatisfiedBy(VersionToken.of("v1")));
        assertFalse(expected.isSatisfiedBy(v2));
        assertFalse(expected.isSatisfiedBy(null));
    }

    @Test
    void of_NullToken_ReturnsAbsent() {
        assertEquals(ExpectedVersion.absent(), ExpectedVersion.of(null));
        assertEquals(ExpectedVersion.matching(v1), ExpectedVersion.of(v1));
    }

    @Test
    void matching_NullToken_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> ExpectedVersion.matching(null)
        );
        assertTrue(exception.getMessage().contains("token cannot be null"));
    }

    @Test
    void versionToken_BlankValue_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> VersionToken.of(""));
        assertThrows(IllegalArgumentException.class, () -> VersionToken.of(null));
    }

    @Test
    void versionToken_EqualityByValue() {
        assertEquals(VersionToken.of("abc"), VersionToken.of("abc"));
        assertEquals(VersionToken.of("abc").hashCode(), VersionToken.of("abc").hashCode());
        assertNotEquals(VersionToken.of("abc"), VersionToken.of("abd"));
    }
}
