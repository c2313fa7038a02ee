package eu.virtualparadox.incidentkb.ingest.loader;

import eu.virtualparadox.incidentkb.ingest.model.EDocumentType;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Infers a {@link EDocumentType} from a file name.
 * <p>
 * Rules are case-insensitive substring checks evaluated in a fixed priority order; the first
 * matching rule wins. Risk-methodology names are checked before generic framework names, so
 * {@code "magerit_framework.txt"} is a risk methodology.
 */
@Component
public class DocumentClassifier {

    public EDocumentType classify(final String filename) {
        if (filename == null) {
            return EDocumentType.GENERAL;
        }
        final String name = filename.toLowerCase(Locale.ROOT);

        if (name.contains("magerit") || name.contains("medicion_riesgo")) {
            return EDocumentType.RISK_METHODOLOGY;
        }
        if (name.contains("principios")) {
            return EDocumentType.SECURITY_PRINCIPLES;
        }
        if (name.contains("riesgo") && name.contains("ti")) {
            return EDocumentType.IT_RISK_MANAGEMENT;
        }
        if (name.contains("marco") || name.contains("framework")) {
            return EDocumentType.REGULATORY_FRAMEWORK;
        }
        if (name.contains("compliance") || name.contains("cumplimiento")) {
            return EDocumentType.COMPLIANCE;
        }
        return EDocumentType.GENERAL;
    }
}
