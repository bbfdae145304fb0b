package com.eainde.truckticket.config;

import com.eainde.truckticket.model.QuantityUnit;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDate;
import java.util.EnumMap;
import java.util.Map;

/**
 * Settings bound from {@code pipeline.*}. Defaults match {@code application.yml}.
 */
@Data
@ConfigurationProperties(prefix = "pipeline")
public class PipelineProperties {

    private Templates templates = new Templates();
    private Synonyms synonyms = new Synonyms();
    private ReferenceData referenceData = new ReferenceData();
    private Defaults defaults = new Defaults();
    private Vendor vendor = new Vendor();
    private Validation validation = new Validation();
    private Batch batch = new Batch();
    private Persistence persistence = new Persistence();

    @Data
    public static class Templates {
        private String location = "classpath:vendor-templates.yml";
        /** Directory holding the logo images named by {@code logo_ref}; unset disables logo matching. */
        private String logoDirectory;
    }

    @Data
    public static class Synonyms {
        private String location = "classpath:synonyms.yml";
    }

    @Data
    public static class ReferenceData {
        private String location = "classpath:reference-data.yml";
    }

    @Data
    public static class Defaults {
        private String job = "24-105";
        private String ticketType = "EXPORT";
        private String material = "CLASS_2_CONTAMINATED";
        private QuantityUnit quantityUnit = QuantityUnit.TONS;
    }

    @Data
    public static class Vendor {
        private double minConfidence = 0.80;
        private double logoThreshold = 0.85;
    }

    @Data
    public static class Validation {
        private int duplicateWindowDays = 120;
        private double lowConfidenceThreshold = 0.60;
        private LocalDate earliestTicketDate = LocalDate.of(2020, 1, 1);
        private int maxFutureDays = 7;
        private Map<QuantityUnit, BigDecimal> unusualQuantity = defaultLimits();

        private static Map<QuantityUnit, BigDecimal> defaultLimits() {
            Map<QuantityUnit, BigDecimal> limits = new EnumMap<>(QuantityUnit.class);
            limits.put(QuantityUnit.TONS, new BigDecimal("50"));
            limits.put(QuantityUnit.CY, new BigDecimal("40"));
            limits.put(QuantityUnit.LOADS, new BigDecimal("10"));
            return limits;
        }
    }

    @Data
    public static class Batch {
        /** 0 means one worker per available processor. */
        private int workers = 0;
        private int retryAttempts = 2;
        private Duration initialBackoff = Duration.ofMillis(500);
        private Duration maxBackoff = Duration.ofSeconds(10);
        private String processedBy = "truck-ticket-pipeline";
    }

    @Data
    public static class Persistence {
        /** {@code memory} or {@code jdbc}. */
        private String mode = "memory";
        private boolean preloadReferenceData = false;
    }
}
