package dev.pekelund.efactura.company;

import java.util.List;
import java.util.Optional;

public interface CompanyDirectory {

    Optional<Company> findById(String companyId);

    List<Company> findAutoSyncCompanies();
}
