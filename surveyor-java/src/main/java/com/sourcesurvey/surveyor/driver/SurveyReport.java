package com.sourcesurvey.surveyor.driver;

import com.sourcesurvey.surveyor.report.Category;
import com.sourcesurvey.surveyor.report.CategoryResult;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * What a finished survey produced.
 */
public record SurveyReport(
        List<CategoryResult> results,
        int packagesDiscovered,
        int packagesAnalyzed,
        int packagesSkipped,
        Duration elapsed
) {
    public SurveyReport {
        results = List.copyOf(results);
    }

    public Optional<CategoryResult> result(Category category) {
        return results.stream().filter(r -> r.category() == category).findFirst();
    }

    /** Count for {@code category}, 0 when it was not part of the run. */
    public int count(Category category) {
        return result(category).map(CategoryResult::count).orElse(0);
    }
}
