package com.eainde.truckticket;

import com.eainde.truckticket.ocr.BoundingBox;
import com.eainde.truckticket.ocr.OcrLine;
import com.eainde.truckticket.ocr.OcrPage;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds OCR pages for tests: one line per row, stacked top to bottom in the left half.
 */
public final class TestPages {

    private TestPages() {}

    public static OcrPage page(int pageNumber, String... lines) {
        return OcrPage.of(pageNumber, lines(lines));
    }

    public static List<OcrLine> lines(String... texts) {
        List<OcrLine> lines = new ArrayList<>();
        for (int i = 0; i < texts.length; i++) {
            double y0 = 0.05 + i * 0.06;
            lines.add(OcrLine.of(texts[i], BoundingBox.of(0.05, y0, 0.6, y0 + 0.04)));
        }
        return lines;
    }

    public static Ticket ticket() {
        return new Ticket();
    }

    /**
     * Fluent ticket page. Null values leave the line out.
     */
    public static final class Ticket {
        private String header = "LDI YARD";
        private String number = "12345678";
        private String date = "10/17/2024";
        private String quantity = "12.5 TONS";
        private String material = "Non Contaminated";
        private String source = "SPG";
        private String destination = "LDI Yard";
        private String manifest;
        private String truck = "42";

        public Ticket header(String header) {
            this.header = header;
            return this;
        }

        public Ticket number(String number) {
            this.number = number;
            return this;
        }

        public Ticket date(String date) {
            this.date = date;
            return this;
        }

        public Ticket quantity(String quantity) {
            this.quantity = quantity;
            return this;
        }

        public Ticket material(String material) {
            this.material = material;
            return this;
        }

        public Ticket source(String source) {
            this.source = source;
            return this;
        }

        public Ticket destination(String destination) {
            this.destination = destination;
            return this;
        }

        public Ticket manifest(String manifest) {
            this.manifest = manifest;
            return this;
        }

        public Ticket truck(String truck) {
            this.truck = truck;
            return this;
        }

        public OcrPage page(int pageNumber) {
            List<String> rows = new ArrayList<>();
            add(rows, header, "");
            add(rows, number, "TICKET NO: ");
            add(rows, date, "DATE: ");
            add(rows, quantity, "QTY: ");
            add(rows, material, "MATERIAL: ");
            add(rows, source, "SOURCE: ");
            add(rows, destination, "DESTINATION: ");
            add(rows, manifest, "MANIFEST NO: ");
            add(rows, truck, "TRUCK: ");
            return TestPages.page(pageNumber, rows.toArray(new String[0]));
        }

        private static void add(List<String> rows, String value, String label) {
            if (value != null) {
                rows.add(label + value);
            }
        }
    }
}
