package com.eainde.truckticket.validation;

import com.eainde.truckticket.extract.FieldNames;
import com.eainde.truckticket.model.ManifestNumbers;
import com.eainde.truckticket.model.ReferenceEntity;
import com.eainde.truckticket.model.ReviewProblem;
import com.eainde.truckticket.model.ReviewReason;
import com.eainde.truckticket.model.TruckTicket;
import com.eainde.truckticket.repository.TicketRepository;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Manifest compliance for regulated loads.
 *
 * <p>A ticket that requires a manifest and carries none, or one that is not 6 to 20
 * letters and digits, yields a CRITICAL {@link ReviewReason#MISSING_MANIFEST} problem.
 * A well-formed manifest already used by the same vendor on the same date yields a
 * WARNING {@link ReviewReason#DUPLICATE_MANIFEST}.</p>
 */
@Slf4j
public class ManifestValidator {

    /** Materials that never need a manifest, whatever the destination. */
    static final Set<String> CLEAN_MATERIALS = Set.of("NON_CONTAMINATED", "CLEAN", "SPOILS", "IMPORT");

    private final TicketRepository tickets;

    public ManifestValidator(TicketRepository tickets) {
        this.tickets = tickets;
    }

    /**
     * Whether a load needs a manifest. An unresolved material counts as regulated.
     *
     * @param material    resolved material, null if unresolved
     * @param destination resolved destination, null if absent
     */
    public static boolean requiresManifest(ReferenceEntity material, ReferenceEntity destination) {
        if (material == null) {
            return true;
        }
        if (material.requiresManifest()) {
            return true;
        }
        boolean clean = CLEAN_MATERIALS.contains(material.canonicalName().toUpperCase(Locale.ROOT));
        return destination != null && destination.requiresManifest() && !clean;
    }

    public List<ReviewProblem> validate(TruckTicket candidate) {
        List<ReviewProblem> problems = new ArrayList<>();
        String manifest = candidate.manifestNumber();
        boolean wellFormed = ManifestNumbers.isWellFormed(manifest);

        if (candidate.manifestRequired() && !wellFormed) {
            String detail = manifest == null
                    ? "Regulated load has no manifest number"
                    : "Manifest number '" + manifest + "' is not 6-20 letters or digits";
            problems.add(ReviewProblem.of(ReviewReason.MISSING_MANIFEST, FieldNames.MANIFEST_NUMBER, detail));
            log.warn("Missing manifest on {} (ticket {})", candidate.pageId(), candidate.ticketNumber());
        }

        if (wellFormed && candidate.vendorId() != null && candidate.ticketDate() != null) {
            Optional<TruckTicket> other = tickets.findByManifest(manifest, candidate.vendorId(), candidate.ticketDate());
            other.filter(t -> !Objects.equals(t.ticketNumber(), candidate.ticketNumber()))
                    .ifPresent(t -> problems.add(ReviewProblem.of(ReviewReason.DUPLICATE_MANIFEST,
                            FieldNames.MANIFEST_NUMBER,
                            "Manifest " + manifest + " already used by ticket " + t.ticketNumber()
                                    + " (#" + t.id() + ") on " + t.ticketDate())));
        }
        return problems;
    }
}
