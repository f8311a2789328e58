package hazop.risk.compliance;

public enum RegulatoryStandardId {
    IEC_61511,
    ISO_31000,
    ISO_9001,
    ATEX_DSEAR,
    PED,
    OSHA_PSM,
    EPA_RMP,
    SEVESO_III
}
