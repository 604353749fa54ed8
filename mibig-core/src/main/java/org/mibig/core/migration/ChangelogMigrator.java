package org.mibig.core.migration;

import org.mibig.core.error.MigrationException;
import org.mibig.core.legacy.LegacyChange;
import org.mibig.core.model.changelog.ChangeLog;
import org.mibig.core.model.changelog.Release;
import org.mibig.core.model.changelog.ReleaseEntry;
import org.mibig.core.model.common.ReleaseVersion;
import org.mibig.core.model.common.SubmitterID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Rebuilds a changelog from v3 release blocks.
 *
 * <p>v3 stores comments, contributors and (sometimes) timestamps as parallel lists that were
 * edited by hand. The shapes observed in the v3 corpus are matched in a fixed order, first match
 * wins:
 * <ol>
 *   <li>timestamps present: review comments are removed and their authors become reviewers of
 *       the release, the remaining lines are zipped with their timestamps</li>
 *   <li>as many contributors as comments: zipped line by line</li>
 *   <li>a single contributor: authored every comment</li>
 *   <li>last contributor is the system account: leading real contributors pair with the first
 *       comments, the system account authored the rest</li>
 *   <li>a single comment: authored by all contributors together</li>
 *   <li>system account everywhere except the last contributor: the system account authored all
 *       comments but the last</li>
 *   <li>real submitter, system accounts, real last contributor, first comment
 *       {@code "Submitted"}: split accordingly</li>
 * </ol>
 * Any other shape is a {@link MigrationException}. Entries without timestamps get the release
 * date and the system account as reviewer.
 */
public class ChangelogMigrator {

    private static final Logger log = LoggerFactory.getLogger(ChangelogMigrator.class);

    /** Publication dates of the v3-era releases. */
    public static final Map<String, LocalDate> RELEASE_DATES = Map.of(
        "1.0", LocalDate.of(2015, 6, 12),
        "1.1", LocalDate.of(2015, 8, 17),
        "1.2", LocalDate.of(2015, 12, 24),
        "1.3", LocalDate.of(2016, 9, 3),
        "1.4", LocalDate.of(2018, 8, 6),
        "2.0", LocalDate.of(2019, 10, 16),
        "3.0", LocalDate.of(2022, 9, 15),
        "3.1", LocalDate.of(2022, 10, 7)
    );

    public static final Set<String> REVIEW_MESSAGES = Set.of(
        "Changes reviewed and approved.",
        "Changes reviewed and approved",
        "Entry reviewed and approved.",
        "Reviewed changes and approved."
    );

    private static final String SUBMITTED = "Submitted";

    /**
     * Migrates the full changelog. Releases are numbered from 1 in order, except {@code next}.
     *
     * @throws MigrationException if a release has an unknown version or an unmatched shape
     */
    public ChangeLog migrate(List<LegacyChange> changes) {
        List<Release> releases = new ArrayList<>();
        for (int i = 0; i < changes.size(); i++) {
            releases.add(migrateRelease(changes.get(i), i + 1));
        }
        log.debug("Migrated {} changelog releases", releases.size());
        return new ChangeLog(releases);
    }

    Release migrateRelease(LegacyChange change, int number) {
        ReleaseVersion version;
        LocalDate date;
        if (change.isNext()) {
            version = ReleaseVersion.NEXT;
            date = null;
        } else {
            version = new ReleaseVersion(Integer.toString(number));
            date = RELEASE_DATES.get(change.version());
            if (date == null) {
                throw new MigrationException("Unknown MIBiG release version '" + change.version() + "'");
            }
        }

        List<ReleaseEntry> entries;
        if (change.hasTimestamps()) {
            entries = fromTimestamps(change);
        } else {
            if (date == null) {
                throw new MigrationException("Release 'next' has no timestamps to date its entries");
            }
            entries = fromShape(change.contributors(), change.comments(), date);
        }
        return new Release(version, date, entries);
    }

    private List<ReleaseEntry> fromTimestamps(LegacyChange change) {
        List<String> comments = new ArrayList<>(change.comments());
        List<String> contributors = new ArrayList<>(change.contributors());
        List<String> timestamps = new ArrayList<>(change.updatedAt());
        if (comments.size() != contributors.size() || comments.size() != timestamps.size()) {
            throw new MigrationException(String.format(
                "Mismatch between number of comments (%d), contributors (%d) and timestamps (%d) in release %s",
                comments.size(), contributors.size(), timestamps.size(), change.version()));
        }

        List<SubmitterID> reviewers = new ArrayList<>();
        int i = 0;
        while (i < comments.size()) {
            if (REVIEW_MESSAGES.contains(comments.get(i))) {
                reviewers.add(new SubmitterID(contributors.get(i)));
                comments.remove(i);
                contributors.remove(i);
                timestamps.remove(i);
                continue;
            }
            i++;
        }

        List<ReleaseEntry> entries = new ArrayList<>();
        for (int j = 0; j < comments.size(); j++) {
            entries.add(new ReleaseEntry(
                List.of(new SubmitterID(contributors.get(j))),
                reviewers,
                parseTimestamp(timestamps.get(j)),
                comments.get(j)));
        }
        return entries;
    }

    private List<ReleaseEntry> fromShape(List<String> contributors, List<String> comments, LocalDate date) {
        List<ReleaseEntry> entries = new ArrayList<>();
        String system = SubmitterID.SYSTEM.value();

        if (contributors.isEmpty() || comments.isEmpty()) {
            throw mismatch(contributors, comments);
        }

        if (contributors.size() == comments.size()) {
            for (int i = 0; i < comments.size(); i++) {
                entries.add(entry(List.of(new SubmitterID(contributors.get(i))), date, comments.get(i)));
            }
        } else if (contributors.size() == 1) {
            SubmitterID author = new SubmitterID(contributors.get(0));
            for (String comment : comments) {
                entries.add(entry(List.of(author), date, comment));
            }
        } else if (system.equals(last(contributors))) {
            int j = 0;
            while (!system.equals(contributors.get(j))) {
                if (j >= comments.size()) {
                    throw mismatch(contributors, comments);
                }
                entries.add(entry(List.of(new SubmitterID(contributors.get(j))), date, comments.get(j)));
                j++;
            }
            for (String comment : comments.subList(Math.min(j, comments.size()), comments.size())) {
                entries.add(entry(List.of(SubmitterID.SYSTEM), date, comment));
            }
        } else if (comments.size() == 1) {
            entries.add(entry(contributors.stream().map(SubmitterID::new).toList(), date, comments.get(0)));
        } else if (system.equals(contributors.get(0))) {
            if (!allSystem(contributors.subList(0, contributors.size() - 1))) {
                throw mismatch(contributors, comments);
            }
            for (String comment : comments.subList(0, comments.size() - 1)) {
                entries.add(entry(List.of(SubmitterID.SYSTEM), date, comment));
            }
            entries.add(entry(List.of(new SubmitterID(last(contributors))), date, last(comments)));
        } else if (contributors.size() >= 3
            && SUBMITTED.equals(comments.get(0))
            && allSystem(contributors.subList(1, contributors.size() - 1))) {
            entries.add(entry(List.of(new SubmitterID(contributors.get(0))), date, comments.get(0)));
            for (String comment : comments.subList(1, comments.size() - 1)) {
                entries.add(entry(List.of(SubmitterID.SYSTEM), date, comment));
            }
            entries.add(entry(List.of(new SubmitterID(last(contributors))), date, last(comments)));
        } else {
            throw mismatch(contributors, comments);
        }
        return entries;
    }

    private static ReleaseEntry entry(List<SubmitterID> contributors, LocalDate date, String comment) {
        return new ReleaseEntry(contributors, List.of(SubmitterID.SYSTEM), date, comment);
    }

    private static LocalDate parseTimestamp(String timestamp) {
        String day = timestamp.split("T")[0];
        try {
            return LocalDate.parse(day);
        } catch (DateTimeParseException e) {
            throw new MigrationException("Invalid changelog timestamp '" + timestamp + "'");
        }
    }

    private static boolean allSystem(List<String> contributors) {
        return contributors.stream().allMatch(SubmitterID.SYSTEM.value()::equals);
    }

    private static String last(List<String> values) {
        return values.get(values.size() - 1);
    }

    private static MigrationException mismatch(List<String> contributors, List<String> comments) {
        return new MigrationException(String.format(
            "Mismatch between number of comments (%d) and contributors (%d)", comments.size(), contributors.size()));
    }
}
