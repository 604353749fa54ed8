package org.mibig.core.migration;

import org.mibig.core.error.MigrationException;
import org.mibig.core.legacy.LegacyChange;
import org.mibig.core.model.changelog.ChangeLog;
import org.mibig.core.model.changelog.Release;
import org.mibig.core.model.changelog.ReleaseEntry;
import org.mibig.core.model.common.ReleaseVersion;
import org.mibig.core.model.common.SubmitterID;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ChangelogMigrator}.
 */
class ChangelogMigratorTest {

    private static final String SYSTEM = SubmitterID.SYSTEM.value();
    private static final String ALICE = "BBBBBBBBBBBBBBBBBBBBBBBB";
    private static final String BOB = "CCCCCCCCCCCCCCCCCCCCCCCC";
    private static final LocalDate RELEASE_3_0 = LocalDate.of(2022, 9, 15);

    private final ChangelogMigrator migrator = new ChangelogMigrator();

    @Test
    void migrateRelease_singleContributor_authorsEveryComment() {
        LegacyChange change = new LegacyChange(List.of("Fixed typo", "Added data"), List.of("X"), "3.0", null);

        Release release = migrator.migrateRelease(change, 1);

        assertThat(release.version()).isEqualTo(new ReleaseVersion("1"));
        assertThat(release.date()).isEqualTo(RELEASE_3_0);
        assertThat(release.entries()).hasSize(2).allSatisfy(entry -> {
            assertThat(entry.contributors()).containsExactly(new SubmitterID("X"));
            assertThat(entry.reviewers()).containsExactly(SubmitterID.SYSTEM);
            assertThat(entry.date()).isEqualTo(RELEASE_3_0);
        });
        assertThat(release.entries()).extracting(ReleaseEntry::comment).containsExactly("Fixed typo", "Added data");
    }

    @Test
    void migrateRelease_equalCounts_zipsLineByLine() {
        LegacyChange change = new LegacyChange(List.of("one", "two"), List.of(ALICE, BOB), "2.0", null);

        Release release = migrator.migrateRelease(change, 2);

        assertThat(release.entries()).extracting(entry -> entry.contributors().get(0).value())
            .containsExactly(ALICE, BOB);
    }

    @Test
    void migrateRelease_systemLast_pairsLeadingContributors() {
        LegacyChange change = new LegacyChange(List.of("one", "two", "three"), List.of(ALICE, SYSTEM), "2.0", null);

        Release release = migrator.migrateRelease(change, 1);

        assertThat(release.entries()).extracting(entry -> entry.contributors().get(0).value())
            .containsExactly(ALICE, SYSTEM, SYSTEM);
    }

    @Test
    void migrateRelease_singleComment_isAuthoredByAllContributors() {
        LegacyChange change = new LegacyChange(List.of("Submitted"), List.of(ALICE, BOB), "1.0", null);

        Release release = migrator.migrateRelease(change, 1);

        assertThat(release.entries()).singleElement()
            .satisfies(entry -> assertThat(entry.contributors())
                .containsExactly(new SubmitterID(ALICE), new SubmitterID(BOB)));
    }

    @Test
    void migrateRelease_systemThenRealLast_splitsLastComment() {
        LegacyChange change = new LegacyChange(
            List.of("one", "two", "three"), List.of(SYSTEM, SYSTEM, SYSTEM, ALICE), "1.4", null);

        Release release = migrator.migrateRelease(change, 1);

        assertThat(release.entries()).extracting(entry -> entry.contributors().get(0).value())
            .containsExactly(SYSTEM, SYSTEM, ALICE);
        assertThat(release.entries()).extracting(ReleaseEntry::comment).containsExactly("one", "two", "three");
    }

    @Test
    void migrateRelease_submittedThenSystemThenReal_splitsAccordingly() {
        LegacyChange change = new LegacyChange(
            List.of("Submitted", "Curated", "Fixed"), List.of(ALICE, SYSTEM, SYSTEM, BOB), "1.3", null);

        Release release = migrator.migrateRelease(change, 1);

        assertThat(release.entries()).extracting(entry -> entry.contributors().get(0).value())
            .containsExactly(ALICE, SYSTEM, BOB);
    }

    @Test
    void migrateRelease_unmatchedShape_throws() {
        LegacyChange change = new LegacyChange(List.of("one", "two"), List.of(ALICE, BOB, ALICE), "2.0", null);

        assertThatThrownBy(() -> migrator.migrateRelease(change, 1))
            .isInstanceOf(MigrationException.class)
            .hasMessageContaining("Mismatch between number of comments (2) and contributors (3)");
    }

    @Test
    void migrateRelease_timestamps_removesReviewLinesAndKeepsTheirAuthorsAsReviewers() {
        LegacyChange change = new LegacyChange(
            List.of("Added structure", "Changes reviewed and approved.", "Fixed evidence"),
            List.of(ALICE, BOB, ALICE),
            "3.1",
            List.of("2022-08-30T09:15:00", "2022-09-02T14:00:00", "2022-09-05T08:00:00"));

        Release release = migrator.migrateRelease(change, 3);

        assertThat(release.entries()).hasSize(2);
        assertThat(release.entries()).extracting(ReleaseEntry::date)
            .containsExactly(LocalDate.of(2022, 8, 30), LocalDate.of(2022, 9, 5));
        assertThat(release.entries()).allSatisfy(entry ->
            assertThat(entry.reviewers()).containsExactly(new SubmitterID(BOB)));
    }

    @Test
    void migrateRelease_timestampCountMismatch_throws() {
        LegacyChange change = new LegacyChange(
            List.of("one", "two"), List.of(ALICE, BOB), "3.1", List.of("2022-08-30T09:15:00"));

        assertThatThrownBy(() -> migrator.migrateRelease(change, 1))
            .isInstanceOf(MigrationException.class)
            .hasMessageContaining("timestamps (1)");
    }

    @Test
    void migrateRelease_contributorCountMismatchWithMatchingTimestamps_throws() {
        LegacyChange change = new LegacyChange(
            List.of("one", "two"), List.of(ALICE), "3.1",
            List.of("2022-08-30T09:15:00", "2022-09-02T14:00:00"));

        assertThatThrownBy(() -> migrator.migrateRelease(change, 1))
            .isInstanceOf(MigrationException.class)
            .hasMessageContaining("contributors (1)");
    }

    @Test
    void migrateRelease_nextWithTimestamps_hasNoDate() {
        LegacyChange change = new LegacyChange(
            List.of("Updated"), List.of(ALICE), LegacyChange.NEXT, List.of("2023-01-10T10:00:00"));

        Release release = migrator.migrateRelease(change, 4);

        assertThat(release.version().isNext()).isTrue();
        assertThat(release.date()).isNull();
        assertThat(release.entries()).singleElement()
            .satisfies(entry -> assertThat(entry.date()).isEqualTo(LocalDate.of(2023, 1, 10)));
    }

    @Test
    void migrateRelease_nextWithoutTimestamps_throws() {
        LegacyChange change = new LegacyChange(List.of("Updated"), List.of(ALICE), LegacyChange.NEXT, null);

        assertThatThrownBy(() -> migrator.migrateRelease(change, 4))
            .isInstanceOf(MigrationException.class);
    }

    @Test
    void migrateRelease_unknownVersion_throws() {
        LegacyChange change = new LegacyChange(List.of("one"), List.of(ALICE), "9.9", null);

        assertThatThrownBy(() -> migrator.migrateRelease(change, 1))
            .isInstanceOf(MigrationException.class)
            .hasMessageContaining("9.9");
    }

    @Test
    void migrate_numbersReleasesFromOne() {
        ChangeLog changelog = migrator.migrate(List.of(
            new LegacyChange(List.of("Submitted"), List.of(ALICE), "1.0", null),
            new LegacyChange(List.of("Updated"), List.of(BOB), "2.0", null)));

        assertThat(changelog.releases()).extracting(release -> release.version().value())
            .containsExactly("1", "2");
    }
}
