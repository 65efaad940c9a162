package org.tsdiag.stats.timeseries;

import org.apache.commons.lang3.StringUtils;
import org.tsdiag.stats.SeriesValidation;
import org.tsdiag.stats.Specification;

import java.util.Objects;

/**
 * Results of the unit-root battery and their consensus.
 *
 * Stationary when at least two of the three unit-root tests reject and KPSS does not; unit root when none rejects
 * and KPSS does; anything else is inconclusive.
 */
public final class UnitRootResult {
    private static final int UNIT_ROOT_TESTS = 3;

    private final DfResult dfResult;
    private final AdfResult adfResult;
    private final AdfGlsResult adfGlsResult;
    private final KpssResult kpssResult;
    private final int sampleSize;
    private final Specification specification;

    UnitRootResult(DfResult dfResult, AdfResult adfResult, AdfGlsResult adfGlsResult, KpssResult kpssResult,
                   int sampleSize, Specification specification) {
        this.dfResult = dfResult;
        this.adfResult = adfResult;
        this.adfGlsResult = adfGlsResult;
        this.kpssResult = kpssResult;
        this.sampleSize = sampleSize;
        this.specification = specification;
    }

    public DfResult getDfResult() {
        return dfResult;
    }

    public AdfResult getAdfResult() {
        return adfResult;
    }

    public AdfGlsResult getAdfGlsResult() {
        return adfGlsResult;
    }

    public KpssResult getKpssResult() {
        return kpssResult;
    }

    public int getSampleSize() {
        return sampleSize;
    }

    public Specification getSpecification() {
        return specification;
    }

    /**
     * Number of DF, ADF and ADF-GLS tests rejecting the unit root at {@code alpha}.
     */
    public int unitRootRejections(double alpha) {
        int rejections = 0;
        if (dfResult.rejectsUnitRoot(alpha)) {
            rejections++;
        }
        if (adfResult.rejectsUnitRoot(alpha)) {
            rejections++;
        }
        if (adfGlsResult.rejectsUnitRoot(alpha)) {
            rejections++;
        }
        return rejections;
    }

    public Verdict verdict(double alpha) {
        int rejections = unitRootRejections(alpha);
        boolean kpssRejects = kpssResult.rejectsStationarity(alpha);
        if (rejections >= 2 && !kpssRejects) {
            return Verdict.STATIONARY;
        }
        if (rejections == 0 && kpssRejects) {
            return Verdict.UNIT_ROOT;
        }
        return Verdict.INCONCLUSIVE;
    }

    public boolean isStationary() {
        return isStationary(0.05);
    }

    public boolean isStationary(double alpha) {
        return verdict(alpha) == Verdict.STATIONARY;
    }

    public boolean hasUnitRoot() {
        return hasUnitRoot(0.05);
    }

    public boolean hasUnitRoot(double alpha) {
        return verdict(alpha) == Verdict.UNIT_ROOT;
    }

    public String getConsensus() {
        return getConsensus(0.05);
    }

    public String getConsensus(double alpha) {
        int rejections = unitRootRejections(alpha);
        boolean kpssRejects = kpssResult.rejectsStationarity(alpha);
        String counted = "- " + rejections + "/" + UNIT_ROOT_TESTS + " unit root tests reject the null hypothesis\n";
        StringBuilder consensus = new StringBuilder();
        switch (verdict(alpha)) {
            case STATIONARY:
                consensus.append("Strong evidence of STATIONARITY:\n").append(counted)
                        .append("- KPSS test does not reject stationarity\n")
                        .append("Conclusion: Series appears to be stationary");
                break;
            case UNIT_ROOT:
                consensus.append("Strong evidence of UNIT ROOT (non-stationarity):\n")
                        .append("- All unit root tests fail to reject the null hypothesis\n")
                        .append("- KPSS test rejects stationarity\n")
                        .append("Conclusion: Series appears to have a unit root");
                break;
            default:
                if (rejections >= 2) {
                    consensus.append("Mixed evidence, leaning toward STATIONARITY:\n").append(counted)
                            .append("- But KPSS suggests non-stationarity\n")
                            .append("Conclusion: Results are conflicting, but majority suggests stationarity");
                } else if (kpssRejects) {
                    consensus.append("Mixed evidence, leaning toward UNIT ROOT:\n").append(counted)
                            .append("- KPSS test rejects stationarity\n")
                            .append("Conclusion: Results are conflicting, but evidence suggests unit root");
                } else {
                    consensus.append("INCONCLUSIVE evidence:\n").append(counted)
                            .append("- KPSS test does not reject stationarity\n")
                            .append("Conclusion: Results are mixed, consider additional analysis");
                }
        }
        return consensus.toString();
    }

    public String summary() {
        return summary(0.05);
    }

    public String summary(double alpha) {
        SeriesValidation.requireAlpha(alpha);
        String banner = StringUtils.repeat('=', 60);
        StringBuilder sb = new StringBuilder();
        sb.append("Unit Root Test Summary\n").append(banner).append('\n');
        sb.append("Sample size: ").append(sampleSize).append('\n');
        sb.append("Type: ").append(specification).append('\n');
        sb.append(String.format("Significance level: %.1f%%%n", alpha * 100));
        sb.append(banner).append("\n\n");
        appendUnitRootTest(sb, 1, dfResult, alpha);
        appendUnitRootTest(sb, 2, adfResult, alpha);
        appendUnitRootTest(sb, 3, adfGlsResult, alpha);
        sb.append("4. KPSS Test (tests stationarity, opposite null):\n");
        sb.append("   Lags: ").append(kpssResult.getLags()).append('\n');
        sb.append(String.format("   Statistic: %.4f%n", kpssResult.getStatistic()));
        sb.append(String.format("   Critical value: %.4f%n", kpssResult.getCriticalValue(alpha)));
        sb.append("   Conclusion: ").append(kpssResult.interpret(alpha)).append("\n\n");
        sb.append(banner).append('\n').append("Overall Assessment:\n").append(banner).append('\n');
        sb.append(getConsensus(alpha));
        return sb.toString();
    }

    private static void appendUnitRootTest(StringBuilder sb, int position, UnitRootTestResult result, double alpha) {
        sb.append(position).append(". ").append(result.getTestName()).append(":\n");
        sb.append("   Lags: ").append(result.getLag()).append('\n');
        sb.append(String.format("   Statistic: %.4f%n", result.getStatistic()));
        sb.append(String.format("   Critical value: %.4f%n", result.getCriticalValue(alpha)));
        sb.append("   Conclusion: ").append(result.interpret(alpha)).append("\n\n");
    }

    public String interpret() {
        return interpret(0.05);
    }

    public String interpret(double alpha) {
        int rejections = unitRootRejections(alpha);
        String evidence = rejections + "/" + UNIT_ROOT_TESTS + " unit root tests reject, KPSS "
                + (kpssResult.rejectsStationarity(alpha) ? "rejects" : "does not reject") + " stationarity";
        switch (verdict(alpha)) {
            case STATIONARY:
                return "Series appears stationary (" + evidence + ")";
            case UNIT_ROOT:
                return "Series appears to have a unit root (" + evidence + ")";
            default:
                return "Inconclusive (" + evidence + ")";
        }
    }

    public String evaluate() {
        return String.format("Unit root battery:%n"
                        + "Sample size: %d, type: %s%n"
                        + "DF: %.4f, ADF: %.4f (lag %d), ADF-GLS: %.4f (lag %d), KPSS: %.4f (lag %d)%n"
                        + "Conclusion: %s at 5%% significance level",
                sampleSize, specification, dfResult.getStatistic(), adfResult.getStatistic(), adfResult.getLag(),
                adfGlsResult.getStatistic(), adfGlsResult.getLag(), kpssResult.getStatistic(), kpssResult.getLags(),
                verdict(0.05));
    }

    @Override
    public String toString() {
        return summary();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        UnitRootResult that = (UnitRootResult) o;
        return sampleSize == that.sampleSize
                && specification == that.specification
                && dfResult.equals(that.dfResult)
                && adfResult.equals(that.adfResult)
                && adfGlsResult.equals(that.adfGlsResult)
                && kpssResult.equals(that.kpssResult);
    }

    @Override
    public int hashCode() {
        return Objects.hash(dfResult, adfResult, adfGlsResult, kpssResult, sampleSize, specification);
    }
}
