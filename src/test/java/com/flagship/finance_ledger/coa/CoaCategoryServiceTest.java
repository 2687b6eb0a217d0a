package com.flagship.finance_ledger.coa;

import com.flagship.finance_ledger.coa.dto.CoaCategoryRequest;
import com.flagship.finance_ledger.exception.ReferentialConflictException;
import com.flagship.finance_ledger.exception.ValidationFailedException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Uses a repository mock backed by a map so seeding and tree building see
 * the rows they insert.
 */
class CoaCategoryServiceTest {

    private final Map<Long, CoaCategory> rows = new LinkedHashMap<>();
    private CoaCategoryRepository repository;
    private CoaCategoryService service;

    @BeforeEach
    void setUp() {
        repository = mock(CoaCategoryRepository.class);
        service = new CoaCategoryService(repository);

        when(repository.insert(any())).thenAnswer(invocation -> {
            CoaCategory category = invocation.getArgument(0);
            long id = rows.size() + 1L;
            rows.put(id, CoaCategory.builder()
                .id(id)
                .parentId(category.getParentId())
                .name(category.getName())
                .code(category.getCode())
                .categoryType(category.getCategoryType())
                .level(category.getLevel())
                .build());
            return id;
        });
        when(repository.findById(anyLong()))
            .thenAnswer(invocation -> Optional.ofNullable(rows.get(invocation.<Long>getArgument(0))));
        when(repository.findByCode(anyString())).thenAnswer(invocation -> rows.values().stream()
            .filter(row -> row.getCode().equals(invocation.getArgument(0)))
            .findFirst());
        when(repository.findAll()).thenAnswer(invocation -> new ArrayList<>(rows.values()));
    }

    private CoaCategory byCode(String code) {
        return rows.values().stream().filter(row -> row.getCode().equals(code)).findFirst().orElseThrow();
    }

    @Test
    @DisplayName("Standard categories are seeded once with parents and levels")
    void initStandardCategories() {
        assertEquals(15, service.initStandardCategories());
        assertEquals(0, service.initStandardCategories());

        CoaCategory assets = byCode("1000");
        CoaCategory currentAssets = byCode("1100");
        assertNull(assets.getParentId());
        assertEquals(0, assets.getLevel());
        assertEquals(assets.getId(), currentAssets.getParentId());
        assertEquals(1, currentAssets.getLevel());
        assertEquals("Expense", byCode("5100").getCategoryType());
    }

    @Test
    @DisplayName("Tree nests children under their roots")
    void tree() {
        service.initStandardCategories();

        List<CoaCategoryNode> tree = service.tree();

        assertEquals(5, tree.size());
        assertEquals("Assets", tree.get(0).getCategory().getName());
        assertEquals(2, tree.get(0).getChildren().size());
        assertTrue(tree.get(0).getChildren().get(0).getChildren().isEmpty());
    }

    @Test
    @DisplayName("A category cannot become its own parent or move under a descendant")
    void updateCycles() {
        service.initStandardCategories();
        long assets = byCode("1000").getId();
        long current = byCode("1100").getId();
        when(repository.findAncestry(current)).thenReturn(List.of(current, assets));

        CoaCategoryRequest selfParent = CoaCategoryRequest.builder()
            .parentId(assets).name("Assets").code("1000").categoryType("Asset").build();
        CoaCategoryRequest underChild = CoaCategoryRequest.builder()
            .parentId(current).name("Assets").code("1000").categoryType("Asset").build();

        assertEquals("A category cannot be its own parent",
            assertThrows(ValidationFailedException.class, () -> service.update(assets, selfParent)).getMessage());
        assertThrows(ValidationFailedException.class, () -> service.update(assets, underChild));
        verify(repository, never()).update(any());
    }

    @Test
    @DisplayName("Category with children or accounts cannot be deleted")
    void deleteBlocked() {
        service.initStandardCategories();
        long assets = byCode("1000").getId();
        long fixed = byCode("1200").getId();
        when(repository.countChildren(assets)).thenReturn(2L);
        when(repository.countAccounts(fixed)).thenReturn(1L);

        assertThrows(ReferentialConflictException.class, () -> service.delete(assets));
        assertThrows(ReferentialConflictException.class, () -> service.delete(fixed));
        verify(repository, never()).delete(anyLong());
    }
}
