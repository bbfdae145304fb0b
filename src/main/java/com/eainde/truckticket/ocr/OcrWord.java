package com.eainde.truckticket.ocr;

/**
 * @param confidence recognizer confidence in [0,1]
 */
public record OcrWord(String value, BoundingBox box, double confidence) {

    public OcrWord toUpright(int orientationDegrees) {
        return new OcrWord(value, box.toUpright(orientationDegrees), confidence);
    }
}
