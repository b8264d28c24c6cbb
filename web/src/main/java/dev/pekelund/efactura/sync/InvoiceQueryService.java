package dev.pekelund.efactura.sync;

import dev.pekelund.efactura.anaf.AnafClient;
import dev.pekelund.efactura.anaf.AnafClientFactory;
import dev.pekelund.efactura.company.CompanyDirectory;
import dev.pekelund.efactura.invoice.InvoiceRecord;
import dev.pekelund.efactura.invoice.InvoiceRecordStore;
import dev.pekelund.efactura.invoice.InvoiceSearch;
import dev.pekelund.efactura.invoiceparser.InvoiceDocumentParser;
import dev.pekelund.efactura.invoiceparser.InvoiceParsingException;
import dev.pekelund.efactura.invoiceparser.InvoiceProjectionMapper;
import dev.pekelund.efactura.invoiceparser.ParsedInvoice;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

@Service
public class InvoiceQueryService {

    private static final Logger LOGGER = LoggerFactory.getLogger(InvoiceQueryService.class);

    private final InvoiceRecordStore records;
    private final CompanyDirectory companyDirectory;
    private final AnafClientFactory anafClientFactory;
    private final InvoiceArtifactRetriever retriever;
    private final InvoiceDocumentParser parser;

    public InvoiceQueryService(InvoiceRecordStore records, CompanyDirectory companyDirectory,
        AnafClientFactory anafClientFactory, InvoiceArtifactRetriever retriever, InvoiceDocumentParser parser) {
        this.records = records;
        this.companyDirectory = companyDirectory;
        this.anafClientFactory = anafClientFactory;
        this.retriever = retriever;
        this.parser = parser;
    }

    /**
     * Loads the read model of an invoice. The stored projection is used when present; otherwise the stored
     * document text is parsed on the fly.
     */
    public Optional<InvoiceProjection> getInvoiceProjection(String id) {
        return records.findById(id).map(record -> InvoiceProjection.of(record, document(record)));
    }

    /**
     * Lists the invoices of a company, newest sync first.
     *
     * @return empty when the company is not registered
     */
    public Optional<InvoiceListing> listInvoices(InvoiceSearch search) {
        return companyDirectory.findById(search.companyId())
            .map(company -> new InvoiceListing(company, records.search(search)));
    }

    /**
     * Archive of an invoice for download, from ANAF, the artifact cache or the stored text, in that order.
     */
    public Optional<ArtifactDelivery> downloadArtifact(String id) {
        Optional<InvoiceRecord> record = records.findById(id);
        if (record.isEmpty()) {
            return Optional.empty();
        }
        Optional<AnafClient> client = companyDirectory.findById(record.get().companyId())
            .filter(company -> StringUtils.hasText(company.ownerUserId()))
            .map(company -> anafClientFactory.forUser(company.ownerUserId()));
        return retriever.deliver(record.get(), client);
    }

    private ParsedInvoice document(InvoiceRecord record) {
        ParsedInvoice stored = InvoiceProjectionMapper.fromProjection(record.projection());
        if (stored != null) {
            return stored;
        }
        String text = InvoiceRecordAssembler.usableDocumentText(record);
        if (text == null) {
            return null;
        }
        try {
            return parser.extract(text);
        } catch (InvoiceParsingException ex) {
            LOGGER.debug("Stored document of invoice {} is unparsable: {}", record.id(), ex.getMessage());
            return null;
        }
    }
}
