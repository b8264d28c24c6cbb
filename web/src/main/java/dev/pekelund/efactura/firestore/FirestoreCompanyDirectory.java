package dev.pekelund.efactura.firestore;

import com.google.cloud.firestore.DocumentSnapshot;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.QueryDocumentSnapshot;
import com.google.cloud.firestore.QuerySnapshot;
import dev.pekelund.efactura.company.Company;
import dev.pekelund.efactura.company.CompanyDirectory;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Repository;
import org.springframework.util.StringUtils;

/**
 * Reads registered companies. Company registration itself happens elsewhere; read failures are logged and
 * reported as absent.
 */
@Repository
public class FirestoreCompanyDirectory implements CompanyDirectory {

    private static final Logger log = LoggerFactory.getLogger(FirestoreCompanyDirectory.class);

    private final Optional<Firestore> firestore;
    private final FirestoreProperties properties;

    public FirestoreCompanyDirectory(ObjectProvider<Firestore> firestoreProvider, FirestoreProperties properties) {
        this.firestore = Optional.ofNullable(firestoreProvider.getIfAvailable());
        this.properties = properties;
    }

    @Override
    public Optional<Company> findById(String companyId) {
        if (firestore.isEmpty() || !StringUtils.hasText(companyId)) {
            return Optional.empty();
        }
        try {
            DocumentSnapshot snapshot = firestore.get()
                .collection(properties.getCompaniesCollection())
                .document(companyId)
                .get()
                .get();
            if (!snapshot.exists()) {
                return Optional.empty();
            }
            return Optional.ofNullable(toCompany(snapshot.getId(), snapshot.getData()));
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while loading company {} from Firestore", companyId, ex);
            return Optional.empty();
        } catch (ExecutionException ex) {
            log.error("Failed to load company {} from Firestore", companyId, ex);
            return Optional.empty();
        }
    }

    @Override
    public List<Company> findAutoSyncCompanies() {
        if (firestore.isEmpty()) {
            return List.of();
        }
        try {
            QuerySnapshot snapshot = firestore.get()
                .collection(properties.getCompaniesCollection())
                .whereEqualTo("autoSyncEnabled", true)
                .get()
                .get();
            List<Company> companies = new ArrayList<>();
            for (QueryDocumentSnapshot document : snapshot.getDocuments()) {
                Company company = toCompany(document.getId(), document.getData());
                if (company != null) {
                    companies.add(company);
                }
            }
            return companies;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while loading auto-sync companies from Firestore", ex);
            return List.of();
        } catch (ExecutionException ex) {
            log.error("Failed to load auto-sync companies from Firestore", ex);
            return List.of();
        }
    }

    static Company toCompany(String id, Map<String, Object> data) {
        if (data == null) {
            return null;
        }
        String taxId = FirestoreValues.string(data.get("taxId"));
        if (taxId == null) {
            log.warn("Company {} has no tax id and cannot be synchronized", id);
            return null;
        }
        return new Company(
            id,
            taxId,
            FirestoreValues.string(data.get("name")),
            FirestoreValues.string(data.get("ownerUserId")),
            Boolean.TRUE.equals(data.get("autoSyncEnabled")),
            FirestoreValues.integer(data.get("syncIntervalHours"), Company.DEFAULT_SYNC_INTERVAL_HOURS));
    }
}
