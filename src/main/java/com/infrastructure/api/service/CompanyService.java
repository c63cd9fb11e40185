package com.infrastructure.api.service;

import com.infrastructure.api.dto.CompanyRequest;
import com.infrastructure.api.model.Company;
import com.infrastructure.api.repository.CompanyRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Service
public class CompanyService {

    private static final Logger logger = LoggerFactory.getLogger(CompanyService.class);

    private final CompanyRepository companyRepository;

    public CompanyService(CompanyRepository companyRepository) {
        this.companyRepository = companyRepository;
    }

    public List<Company> findAll() {
        return companyRepository.findAll();
    }

    public Company findById(Long id) {
        return companyRepository.findById(id).orElseThrow(ResourceNotFoundException::company);
    }

    public Company create(CompanyRequest request) {
        List<String> missing = new ArrayList<>();
        if (isBlank(request.getName())) missing.add("name");
        if (isBlank(request.getProvince())) missing.add("province");
        if (isBlank(request.getCity())) missing.add("city");
        if (!missing.isEmpty()) {
            throw new IllegalArgumentException("Missing required fields: " + String.join(", ", missing));
        }

        Company company = new Company();
        company.setName(request.getName().trim());
        company.setProvince(request.getProvince());
        company.setCity(request.getCity().trim());
        company.setEmail(request.getEmail());
        company.setNumber(request.getNumber());
        Company saved = companyRepository.save(company);
        logger.info("Created company {} '{}'", saved.getId(), saved.getName());
        return saved;
    }

    /**
     * Deletes the company; its assignments are removed by the foreign key cascade.
     */
    public void delete(Long id) {
        if (companyRepository.deleteCompanyById(id) == 0) {
            throw ResourceNotFoundException.company();
        }
        logger.info("Deleted company {}", id);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
