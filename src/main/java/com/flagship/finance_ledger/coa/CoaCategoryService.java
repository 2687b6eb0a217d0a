package com.flagship.finance_ledger.coa;

import com.flagship.finance_ledger.coa.dto.CoaCategoryRequest;
import com.flagship.finance_ledger.exception.DuplicateEntryException;
import com.flagship.finance_ledger.exception.NotFoundException;
import com.flagship.finance_ledger.exception.ReferentialConflictException;
import com.flagship.finance_ledger.exception.ValidationFailedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Hierarchical chart-of-accounts categories.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CoaCategoryService {

    /** code, name, type, parent code (null for roots); parents come first. */
    private static final String[][] STANDARD_CATEGORIES = {
        {"1000", "Assets", "Asset", null},
        {"1100", "Current Assets", "Asset", "1000"},
        {"1200", "Fixed Assets", "Asset", "1000"},
        {"2000", "Liabilities", "Liability", null},
        {"2100", "Current Liabilities", "Liability", "2000"},
        {"2200", "Long-term Liabilities", "Liability", "2000"},
        {"3000", "Equity", "Equity", null},
        {"3100", "Owner's Equity", "Equity", "3000"},
        {"3200", "Retained Earnings", "Equity", "3000"},
        {"4000", "Revenue", "Revenue", null},
        {"4100", "Sales Revenue", "Revenue", "4000"},
        {"4200", "Other Income", "Revenue", "4000"},
        {"5000", "Expenses", "Expense", null},
        {"5100", "Cost of Goods Sold", "Expense", "5000"},
        {"5200", "Operating Expenses", "Expense", "5000"},
    };

    private final CoaCategoryRepository coaCategoryRepository;

    @Transactional
    public CoaCategory create(CoaCategoryRequest request) {
        validate(request);
        int level = levelUnder(request.getParentId());
        try {
            long id = coaCategoryRepository.insert(CoaCategory.builder()
                .parentId(request.getParentId())
                .name(request.getName().trim())
                .code(request.getCode().trim())
                .categoryType(request.getCategoryType())
                .level(level)
                .build());
            log.info("COA category created: id={}, code={}, level={}", id, request.getCode(), level);
            return get(id);
        } catch (DuplicateKeyException e) {
            throw new DuplicateEntryException("COA category code already exists: " + request.getCode());
        }
    }

    /**
     * Updates a category and re-derives its level and the levels below it.
     * A category cannot be moved under itself or one of its descendants.
     */
    @Transactional
    public CoaCategory update(long id, CoaCategoryRequest request) {
        get(id);
        validate(request);
        if (request.getParentId() != null) {
            if (request.getParentId() == id) {
                throw new ValidationFailedException("A category cannot be its own parent");
            }
            if (coaCategoryRepository.findAncestry(request.getParentId()).contains(id)) {
                throw new ValidationFailedException("A category cannot be moved under one of its descendants");
            }
        }
        int level = levelUnder(request.getParentId());
        try {
            coaCategoryRepository.update(CoaCategory.builder()
                .id(id)
                .parentId(request.getParentId())
                .name(request.getName().trim())
                .code(request.getCode().trim())
                .categoryType(request.getCategoryType())
                .level(level)
                .build());
        } catch (DuplicateKeyException e) {
            throw new DuplicateEntryException("COA category code already exists: " + request.getCode());
        }
        coaCategoryRepository.relevelDescendants(id);
        log.info("COA category updated: id={}, level={}", id, level);
        return get(id);
    }

    @Transactional
    public void delete(long id) {
        get(id);
        if (coaCategoryRepository.countChildren(id) > 0) {
            throw new ReferentialConflictException("COA category " + id + " has child categories");
        }
        if (coaCategoryRepository.countAccounts(id) > 0) {
            throw new ReferentialConflictException("COA category " + id + " is used by accounts");
        }
        coaCategoryRepository.delete(id);
        log.info("COA category deleted: id={}", id);
    }

    @Transactional(readOnly = true)
    public CoaCategory get(long id) {
        return coaCategoryRepository.findById(id).orElseThrow(() -> NotFoundException.of("COA category", id));
    }

    @Transactional(readOnly = true)
    public List<CoaCategory> list() {
        return coaCategoryRepository.findAll();
    }

    /**
     * All categories nested under their parents, roots in code order.
     */
    @Transactional(readOnly = true)
    public List<CoaCategoryNode> tree() {
        List<CoaCategory> all = coaCategoryRepository.findAll();
        Map<Long, List<CoaCategory>> byParent = new LinkedHashMap<>();
        List<CoaCategory> roots = new ArrayList<>();
        for (CoaCategory category : all) {
            if (category.getParentId() == null) {
                roots.add(category);
            } else {
                byParent.computeIfAbsent(category.getParentId(), k -> new ArrayList<>()).add(category);
            }
        }
        List<CoaCategoryNode> nodes = new ArrayList<>();
        for (CoaCategory root : roots) {
            nodes.add(node(root, byParent));
        }
        return nodes;
    }

    /**
     * Seeds the standard five roots and their children. Categories whose
     * code already exists are left alone, so repeated calls are harmless.
     *
     * @return number of categories created
     */
    @Transactional
    public int initStandardCategories() {
        int created = 0;
        for (String[] row : STANDARD_CATEGORIES) {
            if (coaCategoryRepository.findByCode(row[0]).isPresent()) {
                continue;
            }
            Long parentId = null;
            if (row[3] != null) {
                parentId = coaCategoryRepository.findByCode(row[3]).map(CoaCategory::getId).orElse(null);
            }
            coaCategoryRepository.insert(CoaCategory.builder()
                .parentId(parentId)
                .code(row[0])
                .name(row[1])
                .categoryType(row[2])
                .level(levelUnder(parentId))
                .build());
            created++;
        }
        log.info("Standard COA categories initialized: created={}", created);
        return created;
    }

    private CoaCategoryNode node(CoaCategory category, Map<Long, List<CoaCategory>> byParent) {
        List<CoaCategoryNode> children = new ArrayList<>();
        for (CoaCategory child : byParent.getOrDefault(category.getId(), List.of())) {
            children.add(node(child, byParent));
        }
        return new CoaCategoryNode(category, children);
    }

    private int levelUnder(Long parentId) {
        if (parentId == null) {
            return 0;
        }
        return coaCategoryRepository.findById(parentId)
            .map(parent -> parent.getLevel() + 1)
            .orElseThrow(() -> NotFoundException.of("COA category", parentId));
    }

    private static void validate(CoaCategoryRequest request) {
        if (request.getName() == null || request.getName().isBlank()) {
            throw new ValidationFailedException("Name is required");
        }
        if (request.getCode() == null || request.getCode().isBlank()) {
            throw new ValidationFailedException("Code is required");
        }
        if (request.getCategoryType() == null || request.getCategoryType().isBlank()) {
            throw new ValidationFailedException("Category type is required");
        }
    }
}
