package de.bsommerfeld.sparkle.db;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.sparkle.core.domain.Inspiration;
import de.bsommerfeld.sparkle.core.domain.Theme;
import de.bsommerfeld.sparkle.core.domain.ThemeOrder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Read-only integrity audit over both tables. All queries of one
 * {@link #check()} run against the same committed snapshot. Nothing is
 * repaired here; see {@link IntegrityCoordinator#reassignOrphans()} and
 * {@link IntegrityCoordinator#refreshAllCounts()}.
 */
@Singleton
public class DataValidator {

    private static final Logger LOG = LoggerFactory.getLogger(DataValidator.class);
    private static final int PREVIEW_LENGTH = 30;

    private final NoteDatabase database;
    private final ThemeCatalog catalog;
    private final InspirationStore inspirations;

    @Inject
    public DataValidator(NoteDatabase database, ThemeCatalog catalog, InspirationStore inspirations) {
        this.database = database;
        this.catalog = catalog;
        this.inspirations = inspirations;
    }

    public DataValidationResult check() {
        DataValidationResult result = database.readSnapshot(conn -> audit(
                catalog.list(ThemeOrder.NAME_ASC),
                inspirations.getAll(),
                inspirations.getOrphans()));
        LOG.info("[DB] Integrity check: {} themes, {} inspirations, {} issues, {} warnings.",
                result.totalThemes(), result.totalInspirations(), result.issues().size(), result.warnings().size());
        return result;
    }

    private static DataValidationResult audit(List<Theme> themes, List<Inspiration> all, List<Inspiration> orphans) {
        List<String> issues = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        if (!orphans.isEmpty()) {
            issues.add("Found " + orphans.size() + " orphaned inspirations (theme does not exist)");
            for (Inspiration orphan : orphans) {
                warnings.add("Orphaned inspiration " + orphan.id() + ": '" + preview(orphan.content())
                        + "' (theme: '" + orphan.themeName() + "')");
            }
        }

        Map<String, Long> actualCounts = all.stream()
                .collect(Collectors.groupingBy(Inspiration::themeName, Collectors.counting()));
        for (Theme theme : themes) {
            long actual = actualCounts.getOrDefault(theme.name(), 0L);
            if (actual == 0)
                warnings.add("Theme '" + theme.name() + "' has no inspirations");
            if (actual != theme.inspirationCount()) {
                warnings.add("Theme '" + theme.name() + "' caches " + theme.inspirationCount()
                        + " inspirations but has " + actual);
            }
        }

        List<String> duplicates = themes.stream()
                .collect(Collectors.groupingBy(Theme::name, Collectors.counting()))
                .entrySet().stream()
                .filter(entry -> entry.getValue() > 1)
                .map(Map.Entry::getKey)
                .sorted()
                .collect(Collectors.toList());
        if (!duplicates.isEmpty())
            issues.add("Found duplicate themes: " + String.join(", ", duplicates));

        long blank = all.stream().map(Inspiration::content).filter(content -> content == null || content.isBlank()).count();
        if (blank > 0)
            issues.add("Found " + blank + " inspirations with empty content");

        return new DataValidationResult(themes.size(), all.size(), orphans.size(), issues, warnings);
    }

    private static String preview(String content) {
        if (content == null)
            return "";
        return content.length() > PREVIEW_LENGTH ? content.substring(0, PREVIEW_LENGTH) + "..." : content;
    }
}
