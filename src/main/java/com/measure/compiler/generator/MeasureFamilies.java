package com.measure.compiler.generator;

import com.measure.compiler.model.MeasureMetadata;

import java.util.List;
import java.util.Optional;

/**
 * Ordered table of recognized measure families; the first match wins.
 */
public final class MeasureFamilies {
    private final List<MeasureFamily> families;

    public MeasureFamilies(List<MeasureFamily> families) {
        this.families = List.copyOf(families);
    }

    public static MeasureFamilies none() {
        return new MeasureFamilies(List.of());
    }

    public static MeasureFamilies standard() {
        return new MeasureFamilies(List.of(colorectal(), cervical(), breast()));
    }

    public Optional<MeasureFamily> detect(MeasureMetadata metadata) {
        return families.stream().filter(f -> f.matches(metadata)).findFirst();
    }

    static MeasureFamily colorectal() {
        String helpers = String.join("\n",
                "// Colorectal Cancer Screening Helpers",
                "define \"Colonoscopy Performed\":",
                "  [Procedure: \"Colonoscopy\"] Colonoscopy",
                "    where Colonoscopy.status = 'completed'",
                "      and Colonoscopy.performed ends 10 years or less before end of \"Measurement Period\"",
                "",
                "define \"Fecal Occult Blood Test Performed\":",
                "  [Observation: \"Fecal Occult Blood Test (FOBT)\"] FOBT",
                "    where FOBT.status in { 'final', 'amended', 'corrected' }",
                "      and FOBT.effective ends 1 year or less before end of \"Measurement Period\"",
                "      and FOBT.value is not null",
                "",
                "define \"Flexible Sigmoidoscopy Performed\":",
                "  [Procedure: \"Flexible Sigmoidoscopy\"] Sigmoidoscopy",
                "    where Sigmoidoscopy.status = 'completed'",
                "      and Sigmoidoscopy.performed ends 5 years or less before end of \"Measurement Period\"",
                "",
                "define \"FIT DNA Test Performed\":",
                "  [Observation: \"FIT DNA\"] FITTest",
                "    where FITTest.status in { 'final', 'amended', 'corrected' }",
                "      and FITTest.effective ends 3 years or less before end of \"Measurement Period\"",
                "      and FITTest.value is not null",
                "",
                "define \"CT Colonography Performed\":",
                "  [Procedure: \"CT Colonography\"] CTCol",
                "    where CTCol.status = 'completed'",
                "      and CTCol.performed ends 5 years or less before end of \"Measurement Period\"",
                "",
                "define \"Has Colorectal Cancer\":",
                "  exists ([Condition: \"Malignant Neoplasm of Colon\"] Cancer",
                "    where Cancer.clinicalStatus ~ QICoreCommon.\"active\")",
                "",
                "define \"Has Total Colectomy\":",
                "  exists ([Procedure: \"Total Colectomy\"] Colectomy",
                "    where Colectomy.status = 'completed'",
                "      and Colectomy.performed starts before end of \"Measurement Period\")");
        String numerator = String.join("\n",
                "exists \"Colonoscopy Performed\"",
                "    or exists \"Fecal Occult Blood Test Performed\"",
                "    or exists \"Flexible Sigmoidoscopy Performed\"",
                "    or exists \"FIT DNA Test Performed\"",
                "    or exists \"CT Colonography Performed\"");
        return new MeasureFamily("colorectal cancer screening",
                MeasureFamily.titleOrId(List.of("colorectal"), "CMS130"),
                helpers, numerator, List.of("\"Has Colorectal Cancer\"", "\"Has Total Colectomy\""));
    }

    static MeasureFamily cervical() {
        String helpers = String.join("\n",
                "// Cervical Cancer Screening Helpers",
                "define \"Cervical Cytology Within 3 Years\":",
                "  [Observation: \"Pap Test\"] Pap",
                "    where Pap.status in { 'final', 'amended', 'corrected' }",
                "      and Pap.effective ends 3 years or less before end of \"Measurement Period\"",
                "      and Pap.value is not null",
                "",
                "define \"HPV Test Within 5 Years\":",
                "  [Observation: \"HPV Test\"] HPV",
                "    where HPV.status in { 'final', 'amended', 'corrected' }",
                "      and HPV.effective ends 5 years or less before end of \"Measurement Period\"",
                "      and HPV.value is not null",
                "",
                "define \"Has Hysterectomy\":",
                "  exists ([Procedure: \"Hysterectomy with No Residual Cervix\"] Hyst",
                "    where Hyst.status = 'completed'",
                "      and Hyst.performed starts before end of \"Measurement Period\")",
                "",
                "define \"Absence of Cervix Diagnosis\":",
                "  exists ([Condition: \"Congenital or Acquired Absence of Cervix\"] Absence",
                "    where Absence.clinicalStatus ~ QICoreCommon.\"active\")");
        String numerator = String.join("\n",
                "exists \"Cervical Cytology Within 3 Years\"",
                "    or (AgeInYearsAt(date from end of \"Measurement Period\") >= 30",
                "        and exists \"HPV Test Within 5 Years\")");
        return new MeasureFamily("cervical cancer screening",
                MeasureFamily.titleOrId(List.of("cervical"), "CMS124"),
                helpers, numerator, List.of("\"Has Hysterectomy\"", "\"Absence of Cervix Diagnosis\""));
    }

    static MeasureFamily breast() {
        String helpers = String.join("\n",
                "// Breast Cancer Screening Helpers",
                "define \"Mammography Within 27 Months\":",
                "  [DiagnosticReport: \"Mammography\"] Mammogram",
                "    where Mammogram.status in { 'final', 'amended', 'corrected' }",
                "      and Mammogram.effective ends 27 months or less before end of \"Measurement Period\"",
                "",
                "define \"Has Bilateral Mastectomy\":",
                "  exists ([Procedure: \"Bilateral Mastectomy\"] Mastectomy",
                "    where Mastectomy.status = 'completed'",
                "      and Mastectomy.performed starts before end of \"Measurement Period\")",
                "",
                "define \"Has Unilateral Mastectomy Left\":",
                "  exists ([Procedure: \"Unilateral Mastectomy Left\"] LeftMastectomy",
                "    where LeftMastectomy.status = 'completed')",
                "",
                "define \"Has Unilateral Mastectomy Right\":",
                "  exists ([Procedure: \"Unilateral Mastectomy Right\"] RightMastectomy",
                "    where RightMastectomy.status = 'completed')");
        return new MeasureFamily("breast cancer screening",
                MeasureFamily.titleOrId(List.of("breast", "screen"), "CMS125"),
                helpers, "exists \"Mammography Within 27 Months\"",
                List.of("\"Has Bilateral Mastectomy\"",
                        "(\"Has Unilateral Mastectomy Left\" and \"Has Unilateral Mastectomy Right\")"));
    }
}
