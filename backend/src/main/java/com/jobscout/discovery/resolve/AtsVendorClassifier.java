package com.jobscout.discovery.resolve;

import com.jobscout.discovery.model.AtsVendor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Component
public class AtsVendorClassifier {
    private static final Map<AtsVendor, List<String>> MARKERS = new LinkedHashMap<>();

    static {
        MARKERS.put(AtsVendor.WORKDAY, List.of("myworkdayjobs.com", "workdayjobs", "myworkdaysite.com"));
        MARKERS.put(AtsVendor.GREENHOUSE, List.of("greenhouse.io"));
        MARKERS.put(AtsVendor.LEVER, List.of("lever.co"));
        MARKERS.put(AtsVendor.ICIMS, List.of("icims.com"));
        MARKERS.put(AtsVendor.BAMBOOHR, List.of("bamboohr.com"));
        MARKERS.put(AtsVendor.SMARTRECRUITERS, List.of("smartrecruiters.com"));
        MARKERS.put(AtsVendor.JOBVITE, List.of("jobvite.com"));
        MARKERS.put(AtsVendor.TALEO, List.of("taleo.net"));
        MARKERS.put(AtsVendor.SUCCESSFACTORS, List.of("successfactors.com", "successfactors.eu", "sapsf.com"));
    }

    public AtsVendor classify(String url) {
        if (url == null || url.isBlank()) {
            return AtsVendor.UNKNOWN;
        }
        String lower = url.toLowerCase(Locale.ROOT);
        for (Map.Entry<AtsVendor, List<String>> entry : MARKERS.entrySet()) {
            for (String marker : entry.getValue()) {
                if (lower.contains(marker)) {
                    return entry.getKey();
                }
            }
        }
        return AtsVendor.UNKNOWN;
    }
}
