package com.depintel.core.analyzer.impl;

import com.depintel.core.analyzer.AnalysisContext;
import com.depintel.core.analyzer.base.AbstractAnalyzer;
import com.depintel.core.exception.InvalidConfigurationException;
import com.depintel.core.model.AnalysisResult;
import com.depintel.core.model.AnalysisType;
import com.depintel.core.model.DependencyNode;
import com.depintel.core.model.Recommendation;
import com.depintel.core.model.RiskLevel;
import com.depintel.core.model.Severity;
import com.depintel.core.util.LicenseCatalog;
import com.depintel.core.util.LicenseCatalog.Compatibility;
import com.depintel.core.util.LicenseCatalog.LicenseCategory;
import com.depintel.core.util.Scores;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Checks every package's licenses against the project's target license.
 *
 * <p>Risk per dependency: {@code high} when any declared license is incompatible with the
 * target, {@code medium} when compatibility is conditional or a license is unknown (including no
 * license at all), {@code low} otherwise. {@code compliance_percentage} is the share of
 * low-risk dependencies, 100.0 for an empty graph.
 *
 * <p>Option: {@code target_license} (SPDX id or common alias).
 */
public class LicenseComplianceChecker extends AbstractAnalyzer {

    static final String UNKNOWN_LICENSE = "unknown";

    private static final Comparator<HighRiskDependency> DIRECT_FIRST = Comparator
        .comparing((HighRiskDependency d) -> !d.direct())
        .thenComparing(HighRiskDependency::name)
        .thenComparing(HighRiskDependency::ecosystem);

    @Override
    public String getId() {
        return "license-compliance-checker";
    }

    @Override
    public String getDisplayName() {
        return "License Compliance Checker";
    }

    @Override
    public AnalysisType getType() {
        return AnalysisType.LICENSE_COMPLIANCE;
    }

    @Override
    public void validateConfiguration(Map<String, Object> configuration) {
        String target = AnalysisContext.readString(configuration, "target_license", null);
        if (target != null) {
            requireKnownTarget(target);
        }
    }

    @Override
    protected AnalysisResult doAnalyze(AnalysisContext context) {
        String target = requireKnownTarget(
            context.getString("target_license", context.engineConfig().license().defaultTarget()));
        LicenseCategory targetCategory = LicenseCatalog.classify(target);

        List<DependencyLicense> dependencies = new ArrayList<>();
        List<HighRiskDependency> highRisk = new ArrayList<>();
        Map<String, Integer> riskCounts = new LinkedHashMap<>();
        riskCounts.put(RiskLevel.HIGH.label(), 0);
        riskCounts.put(RiskLevel.MEDIUM.label(), 0);
        riskCounts.put(RiskLevel.LOW.label(), 0);
        Map<String, Integer> licenseCounts = new TreeMap<>();
        Map<String, Integer> licenseTypes = new TreeMap<>();
        int unknownLicenses = 0;

        for (DependencyNode node : context.graph().allNodes()) {
            List<String> licenses = new ArrayList<>();
            List<String> categories = new ArrayList<>();
            List<String> reasons = new ArrayList<>();
            RiskLevel risk = RiskLevel.LOW;

            if (node.licenses().isEmpty()) {
                risk = RiskLevel.MEDIUM;
                reasons.add("No license information available");
                licenseCounts.merge(UNKNOWN_LICENSE, 1, Integer::sum);
                licenseTypes.merge(LicenseCategory.UNKNOWN.label(), 1, Integer::sum);
                unknownLicenses++;
            }
            for (String raw : node.licenses()) {
                String license = LicenseCatalog.normalize(raw).orElse(UNKNOWN_LICENSE);
                LicenseCategory category = LicenseCatalog.classify(raw);
                licenses.add(license);
                categories.add(category.label());
                licenseCounts.merge(license, 1, Integer::sum);
                licenseTypes.merge(category.label(), 1, Integer::sum);

                Compatibility compatibility = LicenseCatalog.compatibility(raw, target);
                switch (compatibility) {
                    case INCOMPATIBLE -> {
                        risk = RiskLevel.HIGH;
                        reasons.add(license + " (" + category.label() + ") is incompatible with target license "
                            + target + " (" + targetCategory.label() + ")");
                    }
                    case CONDITIONAL -> {
                        risk = risk == RiskLevel.HIGH ? risk : RiskLevel.MEDIUM;
                        reasons.add(license + " (" + category.label() + ") is compatible with " + target
                            + " only under conditions (source disclosure or linking obligations)");
                    }
                    case UNKNOWN -> {
                        risk = risk == RiskLevel.HIGH ? risk : RiskLevel.MEDIUM;
                        unknownLicenses++;
                        reasons.add(raw + " is not a recognized license");
                    }
                    case COMPATIBLE -> {
                        // No finding
                    }
                }
            }

            riskCounts.merge(risk.label(), 1, Integer::sum);
            dependencies.add(new DependencyLicense(node.name(), node.ecosystem(), node.isDirect(), licenses,
                categories, risk.label(), reasons));
            if (risk == RiskLevel.HIGH) {
                highRisk.add(new HighRiskDependency(node.name(), node.ecosystem(), node.isDirect(), licenses,
                    reasons));
            }
        }
        highRisk.sort(DIRECT_FIRST);

        int total = dependencies.size();
        int low = riskCounts.get(RiskLevel.LOW.label());
        double compliance = total == 0 ? 100.0 : Scores.round(100.0 * low / total, 1);
        String overall = riskCounts.get(RiskLevel.HIGH.label()) > 0 ? RiskLevel.HIGH.label()
            : riskCounts.get(RiskLevel.MEDIUM.label()) > 0 ? RiskLevel.MEDIUM.label()
            : RiskLevel.LOW.label();

        LicenseSummary summary = new LicenseSummary(target, targetCategory.label(), total, riskCounts,
            compliance, licenseCounts, licenseTypes, overall, unknownLicenses);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("dependencies", dependencies);
        details.put("high_risk_dependencies", highRisk);
        return buildResult(summary, details, List.of());
    }

    @Override
    public List<Recommendation> recommend(AnalysisResult result) {
        List<Recommendation> recommendations = new ArrayList<>();
        Object target = result.summaryValue("target_license");
        for (Map<String, Object> entry : result.detailEntries("dependencies")) {
            String name = text(entry, "name");
            String ecosystem = text(entry, "ecosystem");
            String reasons = String.join("; ", strings(entry, "reasons"));
            String risk = text(entry, "risk_level");
            if (RiskLevel.HIGH.label().equals(risk)) {
                recommendations.add(recommendation(name, ecosystem, "license_compliance", Severity.HIGH,
                    "Resolve license conflict with " + name,
                    reasons + ". Replace the dependency, obtain a different license, or relicense the project "
                        + "(target: " + target + ")."));
            } else if (RiskLevel.MEDIUM.label().equals(risk)) {
                recommendations.add(recommendation(name, ecosystem, "license_review", Severity.MEDIUM,
                    "Review license of " + name, reasons + "."));
            }
        }
        return recommendations;
    }

    private static String requireKnownTarget(String target) {
        if (!LicenseCatalog.isKnown(target)) {
            throw new InvalidConfigurationException("Unknown target license: " + target);
        }
        return LicenseCatalog.normalize(target).orElseThrow();
    }

    record DependencyLicense(
        String name,
        String ecosystem,
        boolean direct,
        List<String> licenses,
        List<String> licenseTypes,
        String riskLevel,
        List<String> reasons
    ) {}

    record HighRiskDependency(
        String name,
        String ecosystem,
        boolean direct,
        List<String> licenses,
        List<String> reasons
    ) {}

    record LicenseSummary(
        String targetLicense,
        String targetLicenseType,
        int totalDependencies,
        Map<String, Integer> riskCounts,
        double compliancePercentage,
        Map<String, Integer> licenseCounts,
        Map<String, Integer> licenseTypes,
        String overallRiskLevel,
        int unknownLicenseCount
    ) {}
}
