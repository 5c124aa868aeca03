package com.prpulse.pipeline.category;

import com.prpulse.pipeline.domain.Category;
import com.prpulse.pipeline.store.CategoryStore;
import com.prpulse.pipeline.store.PullRequestStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Category catalogue: the shared defaults, per-organization custom categories
 * and the write paths the categorization collaborator uses on pull requests.
 */
public class CategoryService {

    private static final Logger logger = LoggerFactory.getLogger(CategoryService.class);

    static final int MAX_NAME_LENGTH = 100;
    private static final Pattern HEX_COLOR = Pattern.compile("^#[0-9A-Fa-f]{6}$");

    static final List<Category> DEFAULTS = List.of(
            new Category(0, null, "Bug Fixes", "Fixing issues and bugs", "#F87171", true),
            new Category(0, null, "Technical Debt", "Improving code quality or refactoring", "#FBBF24", true),
            new Category(0, null, "New Features", "Adding new functionality", "#60A5FA", true),
            new Category(0, null, "Product Debt", "Improving user experience", "#A78BFA", true),
            new Category(0, null, "Documentation", "Improving documentation", "#34D399", true));

    private final CategoryStore categories;
    private final PullRequestStore pullRequests;

    public CategoryService(CategoryStore categories, PullRequestStore pullRequests) {
        this.categories = categories;
        this.pullRequests = pullRequests;
    }

    /**
     * Inserts whichever default categories are missing.
     *
     * @return the number of defaults created by this call
     */
    public int seedDefaults() {
        int created = 0;
        for (Category category : DEFAULTS) {
            if (categories.defaultExists(category.name())) {
                continue;
            }
            try {
                categories.insert(null, category.name(), category.description(), category.color(), true);
                created++;
            } catch (DuplicateKeyException e) {
                logger.debug("Default category {} was seeded concurrently", category.name());
            }
        }
        if (created > 0) {
            logger.info("Seeded {} default categories", created);
        }
        return created;
    }

    public List<Category> listForOrganization(long organizationId) {
        return categories.findVisibleTo(organizationId);
    }

    /**
     * @throws IllegalArgumentException   if the name is blank or too long, or the color is not {@code #RRGGBB}
     * @throws CategoryConflictException if the organization already has a category with that name
     */
    public Category createCustom(long organizationId, String name, String description, String color) {
        String trimmed = name != null ? name.trim() : "";
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("Category name is required");
        }
        if (trimmed.length() > MAX_NAME_LENGTH) {
            throw new IllegalArgumentException("Category name must be at most " + MAX_NAME_LENGTH + " characters");
        }
        if (color != null && !HEX_COLOR.matcher(color).matches()) {
            throw new IllegalArgumentException("Category color must look like #RRGGBB, got " + color);
        }

        try {
            Category created = categories.insert(organizationId, trimmed, description, color, false);
            logger.info("Created category '{}' for organization {}", trimmed, organizationId);
            return created;
        } catch (DuplicateKeyException e) {
            throw new CategoryConflictException(
                    "Organization " + organizationId + " already has a category named '" + trimmed + "'", e);
        }
    }

    /**
     * Records a categorization result. A {@code null} category clears the assignment.
     *
     * @return false if the pull request does not exist
     */
    public boolean assign(long pullRequestId, Long categoryId, Double confidence) {
        if (confidence != null && (confidence < 0 || confidence > 1)) {
            throw new IllegalArgumentException("Confidence must be between 0 and 1, got " + confidence);
        }
        if (categoryId != null && categories.findById(categoryId).isEmpty()) {
            throw new IllegalArgumentException("Unknown category " + categoryId);
        }
        return pullRequests.assignCategory(pullRequestId, categoryId, confidence);
    }

    public boolean markProcessing(long pullRequestId, String status, String error) {
        return pullRequests.updateProcessingStatus(pullRequestId, status, error);
    }
}
