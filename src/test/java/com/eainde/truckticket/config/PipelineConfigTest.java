package com.eainde.truckticket.config;

import com.eainde.truckticket.TestPages;
import com.eainde.truckticket.batch.BatchConfig;
import com.eainde.truckticket.batch.BatchProcessor;
import com.eainde.truckticket.batch.BatchResult;
import com.eainde.truckticket.model.QuantityUnit;
import com.eainde.truckticket.model.RunStatus;
import com.eainde.truckticket.ocr.OcrEngine;
import com.eainde.truckticket.processor.ProcessingPolicy;
import com.eainde.truckticket.repository.TicketRepository;
import com.eainde.truckticket.repository.jdbc.JdbcTicketRepository;
import com.eainde.truckticket.repository.memory.InMemoryTicketRepository;
import com.eainde.truckticket.template.VendorTemplateCatalog;
import com.eainde.truckticket.vendor.LogoLibrary;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;

import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PipelineConfigTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(PipelineConfig.class)
            .withBean(OcrEngine.class, () -> file -> List.of(TestPages.ticket().page(1)));

    @Test
    @DisplayName("defaults wire the whole pipeline on in-memory persistence")
    void inMemoryDefaults() {
        runner.run(context -> {
            assertThat(context).hasNotFailed();
            assertThat(context).hasSingleBean(BatchProcessor.class);
            assertThat(context.getBean(TicketRepository.class)).isInstanceOf(InMemoryTicketRepository.class);
            assertThat(context.getBean(VendorTemplateCatalog.class).size()).isEqualTo(4);
            assertThat(context.getBean(LogoLibrary.class).isEmpty()).isTrue();
            assertThat(context.getBean(ProcessingPolicy.class)).isEqualTo(ProcessingPolicy.defaults());
            assertThat(context.getBean(BatchConfig.class).retryAttempts()).isEqualTo(2);
        });
    }

    @Test
    @DisplayName("pipeline.* properties reach the components")
    void overrides() {
        runner.withPropertyValues(
                        "pipeline.batch.retry-attempts=5",
                        "pipeline.batch.workers=3",
                        "pipeline.batch.initial-backoff=1s",
                        "pipeline.validation.unusual-quantity.TONS=60",
                        "pipeline.defaults.quantity-unit=CY")
                .run(context -> {
                    BatchConfig batch = context.getBean(BatchConfig.class);
                    ProcessingPolicy policy = context.getBean(ProcessingPolicy.class);

                    assertThat(batch.retryAttempts()).isEqualTo(5);
                    assertThat(batch.workers()).isEqualTo(3);
                    assertThat(batch.initialBackoff()).hasSeconds(1);
                    assertThat(policy.unusualQuantityLimits().get(QuantityUnit.TONS)).isEqualByComparingTo("60");
                    assertThat(policy.defaultQuantityUnit()).isEqualTo(QuantityUnit.CY);
                });
    }

    @Test
    @DisplayName("a wired batch commits a clean ticket")
    void endToEnd(@TempDir Path dir) throws Exception {
        Path scan = Files.writeString(dir.resolve("scan.pdf"), "ticket scan");

        runner.withPropertyValues("pipeline.batch.workers=1").run(context -> {
            BatchResult result = context.getBean(BatchProcessor.class).process(List.of(scan));

            assertThat(result.getRun().status()).isEqualTo(RunStatus.COMPLETED);
            assertThat(result.getOkCount()).isEqualTo(1);
            assertThat(context.getBean(TicketRepository.class).count()).isEqualTo(1);
        });
    }

    @Test
    @DisplayName("jdbc mode uses the JdbcTemplate repositories")
    void jdbcMode() {
        EmbeddedDatabase db = new EmbeddedDatabaseBuilder()
                .generateUniqueName(true)
                .setType(EmbeddedDatabaseType.H2)
                .addScript("classpath:schema.sql")
                .build();
        try {
            runner.withPropertyValues("pipeline.persistence.mode=jdbc")
                    .withBean(JdbcTemplate.class, () -> new JdbcTemplate(db))
                    .run(context -> {
                        assertThat(context).hasNotFailed();
                        assertThat(context.getBean(TicketRepository.class)).isInstanceOf(JdbcTicketRepository.class);
                    });
        } finally {
            db.shutdown();
        }
    }

    @Test
    @DisplayName("a missing template file fails startup")
    void missingTemplates() {
        runner.withPropertyValues("pipeline.templates.location=classpath:no-such-templates.yml")
                .run(context -> assertThat(context).hasFailed()
                        .getFailure().rootCause().hasMessageContaining("no-such-templates.yml"));
    }

    @Test
    @DisplayName("default quantity bounds")
    void defaultLimits() {
        assertThat(new PipelineProperties().getValidation().getUnusualQuantity())
                .containsEntry(QuantityUnit.LOADS, new BigDecimal("10"));
    }
}
