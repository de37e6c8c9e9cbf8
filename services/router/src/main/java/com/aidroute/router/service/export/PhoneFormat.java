// =============================================================================
// AidRoute - Phone Format
// =============================================================================
package com.aidroute.router.service.export;

final class PhoneFormat {

    private PhoneFormat() {
    }

    /**
     * North American display form {@code (XXX) XXX-XXXX} for numbers with at
     * least ten digits (a leading country code 1 is dropped), the raw text
     * otherwise, {@code N/A} when empty.
     */
    static String display(String phone) {
        if (phone == null || phone.isBlank()) {
            return "N/A";
        }
        String digits = phone.replaceAll("\\D", "");
        if (digits.length() == 11 && digits.charAt(0) == '1') {
            digits = digits.substring(1);
        }
        if (digits.length() >= 10) {
            return "(" + digits.substring(0, 3) + ") " + digits.substring(3, 6) + "-" + digits.substring(6, 10);
        }
        return phone.trim();
    }
}
