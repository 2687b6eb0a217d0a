package com.flagship.finance_ledger.catalog;

import com.flagship.finance_ledger.catalog.dto.ProductRequest;
import com.flagship.finance_ledger.exception.NotFoundException;
import com.flagship.finance_ledger.exception.ReferentialConflictException;
import com.flagship.finance_ledger.exception.ValidationFailedException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class CatalogServiceTest {

    private CatalogRepository catalogRepository;
    private CatalogService catalogService;

    @BeforeEach
    void setUp() {
        catalogRepository = mock(CatalogRepository.class);
        catalogService = new CatalogService(catalogRepository);

        when(catalogRepository.findProduct(11L)).thenReturn(Optional.of(Product.builder().id(11L).name("Rice").build()));
    }

    @Test
    @DisplayName("A product used by purchase or sale lines cannot be deleted")
    void deleteReferencedProduct() {
        when(catalogRepository.countProductReferences(11L)).thenReturn(3L);

        ReferentialConflictException ex = assertThrows(ReferentialConflictException.class,
            () -> catalogService.deleteProduct(11L));

        assertEquals("Product is used by purchase or sale items and cannot be deleted", ex.getMessage());
        verify(catalogRepository, never()).deleteProduct(anyLong());
    }

    @Test
    @DisplayName("An unused product is deleted")
    void deleteUnusedProduct() {
        when(catalogRepository.countProductReferences(11L)).thenReturn(0L);

        catalogService.deleteProduct(11L);

        verify(catalogRepository).deleteProduct(11L);
    }

    @Test
    @DisplayName("Deleting an unknown product is not found")
    void deleteUnknownProduct() {
        when(catalogRepository.findProduct(12L)).thenReturn(Optional.empty());

        assertThrows(NotFoundException.class, () -> catalogService.deleteProduct(12L));
        verify(catalogRepository, never()).countProductReferences(anyLong());
    }

    @Test
    @DisplayName("A supplier with purchases cannot be deleted")
    void deleteReferencedSupplier() {
        when(catalogRepository.findParty(PartyKind.SUPPLIER, 4L))
            .thenReturn(Optional.of(Party.builder().id(4L).fullName("Acme").build()));
        when(catalogRepository.countPartyReferences(PartyKind.SUPPLIER, 4L)).thenReturn(1L);

        ReferentialConflictException ex = assertThrows(ReferentialConflictException.class,
            () -> catalogService.deleteParty(PartyKind.SUPPLIER, 4L));

        assertEquals("Supplier has related records and cannot be deleted", ex.getMessage());
        verify(catalogRepository, never()).deleteParty(any(), anyLong());
    }

    @Test
    @DisplayName("A product pointing at an unknown supplier is rejected before insert")
    void productWithUnknownSupplier() {
        when(catalogRepository.findParty(PartyKind.SUPPLIER, 9L)).thenReturn(Optional.empty());

        assertThrows(NotFoundException.class, () -> catalogService.createProduct(
            ProductRequest.builder().name("Flour").supplierId(9L).build()));
        assertThrows(ValidationFailedException.class, () -> catalogService.createProduct(
            ProductRequest.builder().name("  ").build()));
        verify(catalogRepository, never()).insertProduct(any());
    }
}
