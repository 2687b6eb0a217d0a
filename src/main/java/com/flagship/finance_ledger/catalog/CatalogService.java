package com.flagship.finance_ledger.catalog;

import com.flagship.finance_ledger.catalog.dto.PartyRequest;
import com.flagship.finance_ledger.catalog.dto.ProductRequest;
import com.flagship.finance_ledger.catalog.dto.ServiceRequest;
import com.flagship.finance_ledger.common.Money;
import com.flagship.finance_ledger.exception.NotFoundException;
import com.flagship.finance_ledger.exception.ReferentialConflictException;
import com.flagship.finance_ledger.exception.ValidationFailedException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Suppliers, customers, products and services, plus the existence checks
 * the orchestrators run before writing lines that reference them.
 */
@Service
@RequiredArgsConstructor
public class CatalogService {

    private final CatalogRepository catalogRepository;

    // ==================== Suppliers & customers ====================

    @Transactional
    public Party createParty(PartyKind kind, PartyRequest request) {
        long id = catalogRepository.insertParty(kind, toParty(null, request));
        return requireParty(kind, id);
    }

    @Transactional
    public Party updateParty(PartyKind kind, long id, PartyRequest request) {
        requireParty(kind, id);
        catalogRepository.updateParty(kind, toParty(id, request));
        return requireParty(kind, id);
    }

    @Transactional
    public void deleteParty(PartyKind kind, long id) {
        requireParty(kind, id);
        if (catalogRepository.countPartyReferences(kind, id) > 0) {
            throw new ReferentialConflictException(kind.label() + " has related records and cannot be deleted");
        }
        catalogRepository.deleteParty(kind, id);
    }

    @Transactional(readOnly = true)
    public Party requireParty(PartyKind kind, long id) {
        return catalogRepository.findParty(kind, id).orElseThrow(() -> NotFoundException.of(kind.label(), id));
    }

    @Transactional(readOnly = true)
    public List<Party> listParties(PartyKind kind, String search) {
        return catalogRepository.findParties(kind, search);
    }

    // ==================== Products ====================

    @Transactional
    public Product createProduct(ProductRequest request) {
        Product product = toProduct(null, request);
        return requireProduct(catalogRepository.insertProduct(product));
    }

    @Transactional
    public Product updateProduct(long id, ProductRequest request) {
        requireProduct(id);
        catalogRepository.updateProduct(toProduct(id, request));
        return requireProduct(id);
    }

    @Transactional
    public void deleteProduct(long id) {
        requireProduct(id);
        if (catalogRepository.countProductReferences(id) > 0) {
            throw new ReferentialConflictException("Product is used by purchase or sale items and cannot be deleted");
        }
        catalogRepository.deleteProduct(id);
    }

    @Transactional(readOnly = true)
    public Product requireProduct(long id) {
        return catalogRepository.findProduct(id).orElseThrow(() -> NotFoundException.of("Product", id));
    }

    @Transactional(readOnly = true)
    public List<Product> listProducts(String search) {
        return catalogRepository.findProducts(search);
    }

    // ==================== Services ====================

    @Transactional
    public ServiceOffering createService(ServiceRequest request) {
        return requireService(catalogRepository.insertService(toService(null, request)));
    }

    @Transactional
    public ServiceOffering updateService(long id, ServiceRequest request) {
        requireService(id);
        catalogRepository.updateService(toService(id, request));
        return requireService(id);
    }

    @Transactional
    public void deleteService(long id) {
        requireService(id);
        if (catalogRepository.countServiceReferences(id) > 0) {
            throw new ReferentialConflictException("Service is used by sales and cannot be deleted");
        }
        catalogRepository.deleteService(id);
    }

    @Transactional(readOnly = true)
    public ServiceOffering requireService(long id) {
        return catalogRepository.findService(id).orElseThrow(() -> NotFoundException.of("Service", id));
    }

    @Transactional(readOnly = true)
    public List<ServiceOffering> listServices() {
        return catalogRepository.findServices();
    }

    private Party toParty(Long id, PartyRequest request) {
        requireText(request.getFullName(), "Full name is required");
        requireText(request.getPhone(), "Phone is required");
        requireText(request.getAddress(), "Address is required");
        return Party.builder()
            .id(id)
            .fullName(request.getFullName().trim())
            .phone(request.getPhone())
            .address(request.getAddress())
            .email(request.getEmail())
            .notes(request.getNotes())
            .build();
    }

    private Product toProduct(Long id, ProductRequest request) {
        requireText(request.getName(), "Product name is required");
        if (request.getSupplierId() != null) {
            requireParty(PartyKind.SUPPLIER, request.getSupplierId());
        }
        return Product.builder()
            .id(id)
            .name(request.getName().trim())
            .description(request.getDescription())
            .price(request.getPrice())
            .currencyId(request.getCurrencyId())
            .supplierId(request.getSupplierId())
            .barCode(request.getBarCode())
            .build();
    }

    private ServiceOffering toService(Long id, ServiceRequest request) {
        requireText(request.getName(), "Service name is required");
        return ServiceOffering.builder()
            .id(id)
            .name(request.getName().trim())
            .price(Money.orZero(request.getPrice()))
            .currencyId(request.getCurrencyId())
            .description(request.getDescription())
            .build();
    }

    private static void requireText(String value, String message) {
        if (value == null || value.isBlank()) {
            throw new ValidationFailedException(message);
        }
    }
}
