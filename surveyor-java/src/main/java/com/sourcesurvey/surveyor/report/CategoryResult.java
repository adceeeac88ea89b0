package com.sourcesurvey.surveyor.report;

import java.util.List;

/**
 * Reduced view of every record sharing one category.
 *
 * @param category the category
 * @param count    number of records, independent of the example bound
 * @param examples rendered records in detection order, truncated to the bound
 */
public record CategoryResult(
        Category category,
        int count,
        List<String> examples
) {
    public CategoryResult {
        examples = List.copyOf(examples);
    }

    public String label() { return category.label(); }
}
