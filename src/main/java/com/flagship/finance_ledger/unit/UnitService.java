package com.flagship.finance_ledger.unit;

import com.flagship.finance_ledger.exception.DuplicateEntryException;
import com.flagship.finance_ledger.exception.NotFoundException;
import com.flagship.finance_ledger.exception.ReferentialConflictException;
import com.flagship.finance_ledger.exception.ValidationFailedException;
import com.flagship.finance_ledger.unit.dto.UnitRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@RequiredArgsConstructor
public class UnitService {

    private final UnitRepository unitRepository;

    @Transactional
    public Unit create(UnitRequest request) {
        validate(request);
        long id = unitRepository.insert(request.getName().trim(), request.getGroupId(),
            request.getRatio(), request.isBase());
        if (request.isBase() && request.getGroupId() != null) {
            unitRepository.clearGroupBaseExcept(request.getGroupId(), id);
        }
        return get(id);
    }

    @Transactional
    public Unit update(long id, UnitRequest request) {
        get(id);
        validate(request);
        unitRepository.update(id, request.getName().trim(), request.getGroupId(),
            request.getRatio(), request.isBase());
        if (request.isBase() && request.getGroupId() != null) {
            unitRepository.clearGroupBaseExcept(request.getGroupId(), id);
        }
        return get(id);
    }

    @Transactional
    public void delete(long id) {
        get(id);
        if (unitRepository.countItemReferences(id) > 0) {
            throw new ReferentialConflictException("Unit is used by purchase or sale items and cannot be deleted");
        }
        unitRepository.delete(id);
    }

    @Transactional(readOnly = true)
    public Unit get(long id) {
        return unitRepository.findById(id).orElseThrow(() -> NotFoundException.of("Unit", id));
    }

    @Transactional(readOnly = true)
    public List<Unit> list() {
        return unitRepository.findAll();
    }

    @Transactional(readOnly = true)
    public List<UnitGroup> listGroups() {
        return unitRepository.findAllGroups();
    }

    @Transactional
    public UnitGroup createGroup(String name) {
        if (name == null || name.isBlank()) {
            throw new ValidationFailedException("Unit group name is required");
        }
        try {
            return new UnitGroup(unitRepository.insertGroup(name.trim()), name.trim());
        } catch (DuplicateKeyException e) {
            throw new DuplicateEntryException("Unit group already exists: " + name.trim(), e);
        }
    }

    private void validate(UnitRequest request) {
        if (request.getName() == null || request.getName().isBlank()) {
            throw new ValidationFailedException("Unit name is required");
        }
        if (request.getRatio() == null || request.getRatio().signum() <= 0) {
            throw new ValidationFailedException("Unit ratio must be greater than 0");
        }
        if (request.getGroupId() != null && !unitRepository.groupExists(request.getGroupId())) {
            throw NotFoundException.of("Unit group", request.getGroupId());
        }
    }
}
