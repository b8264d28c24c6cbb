package dev.pekelund.efactura.invoiceparser;

import static dev.pekelund.efactura.invoiceparser.UblTags.ACCOUNTING_CUSTOMER_PARTY;
import static dev.pekelund.efactura.invoiceparser.UblTags.ACCOUNTING_SUPPLIER_PARTY;
import static dev.pekelund.efactura.invoiceparser.UblTags.DOCUMENT_CURRENCY_CODE;
import static dev.pekelund.efactura.invoiceparser.UblTags.DUE_DATE;
import static dev.pekelund.efactura.invoiceparser.UblTags.ID;
import static dev.pekelund.efactura.invoiceparser.UblTags.ISSUE_DATE;

import java.io.IOException;
import java.io.StringReader;
import java.util.List;
import java.util.Optional;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

/**
 * Extracts canonical fields from a UBL 2.1 invoice or credit note as delivered by e-Factura.
 *
 * <p>The document is read without namespace awareness so element names keep their prefixes; all field
 * access goes through {@link UblLookup}. Absent fields come back as null. Only text that cannot be
 * parsed as XML raises {@link InvoiceParsingException}.
 */
@Component
public class InvoiceDocumentParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(InvoiceDocumentParser.class);
    private static final char BYTE_ORDER_MARK = '\uFEFF';

    private final DocumentBuilderFactory documentBuilderFactory;

    public InvoiceDocumentParser() {
        this.documentBuilderFactory = createFactory();
    }

    public ParsedInvoice extract(String documentText) {
        Element root = parse(documentText).getDocumentElement();

        InvoiceParty issuer = PartyExtractor.extract(root, ACCOUNTING_SUPPLIER_PARTY);
        InvoiceParty recipient = PartyExtractor.extract(root, ACCOUNTING_CUSTOMER_PARTY);
        String documentCurrency = UblLookup.text(root, UblPath.of(DOCUMENT_CURRENCY_CODE)).orElse(null);

        AmountSource amountSource = AmountSource.MONETARY_TOTAL;
        Optional<MonetaryAmount> total = MonetaryTotalExtractor.extract(root);
        if (total.isEmpty()) {
            total = AmountVocabularyScanner.scan(root);
            amountSource = total.isPresent() ? AmountSource.VOCABULARY_SCAN : AmountSource.NONE;
            total.ifPresent(amount -> LOGGER.debug("Total {} taken from fallback field {}", amount.value(),
                amount.sourceField()));
        }
        String currency = total.map(MonetaryAmount::currency)
            .filter(StringUtils::hasText)
            .orElse(documentCurrency);

        List<InvoiceLineItem> lineItems = LineItemExtractor.extract(root);

        return new ParsedInvoice(
            UblLookup.localName(root),
            UblLookup.text(root, UblPath.of(ID)).orElse(null),
            UblLookup.text(root, UblPath.of(ISSUE_DATE)).map(UblValues::date).orElse(null),
            UblLookup.text(root, UblPath.of(DUE_DATE)).map(UblValues::date).orElse(null),
            issuer,
            recipient,
            total.map(MonetaryAmount::value).orElse(null),
            currency,
            documentCurrency,
            amountSource,
            lineItems
        );
    }

    private Document parse(String documentText) {
        if (!StringUtils.hasText(documentText)) {
            throw new InvoiceParsingException("Invoice document is empty");
        }
        String text = documentText.charAt(0) == BYTE_ORDER_MARK ? documentText.substring(1) : documentText;
        try {
            DocumentBuilder builder = documentBuilderFactory.newDocumentBuilder();
            builder.setErrorHandler(new LoggingErrorHandler());
            return builder.parse(new InputSource(new StringReader(text.trim())));
        } catch (SAXException | IOException ex) {
            throw new InvoiceParsingException("Invoice document is not well-formed XML: " + ex.getMessage(), ex);
        } catch (ParserConfigurationException ex) {
            throw new IllegalStateException("XML parser is not available", ex);
        }
    }

    private static DocumentBuilderFactory createFactory() {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(false);
        factory.setXIncludeAware(false);
        factory.setExpandEntityReferences(false);
        try {
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
            factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
            factory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
        } catch (ParserConfigurationException ex) {
            throw new IllegalStateException("Unable to configure a secure XML parser", ex);
        }
        return factory;
    }

    private static final class LoggingErrorHandler implements ErrorHandler {

        @Override
        public void warning(SAXParseException exception) {
            LOGGER.debug("XML warning at line {}: {}", exception.getLineNumber(), exception.getMessage());
        }

        @Override
        public void error(SAXParseException exception) throws SAXException {
            throw exception;
        }

        @Override
        public void fatalError(SAXParseException exception) throws SAXException {
            throw exception;
        }
    }
}
