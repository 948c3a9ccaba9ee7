package com.priceprediction.controller;

import com.priceprediction.dto.AreaListResponse;
import com.priceprediction.dto.FormPolicyResponse;
import com.priceprediction.dto.PropertyTypesResponse;
import com.priceprediction.dto.RegistrationTypesResponse;
import com.priceprediction.dto.ReloadResponse;
import com.priceprediction.dto.SizeSuggestionResponse;
import com.priceprediction.dto.ValidationRulesResponse;
import com.priceprediction.service.ReferenceCatalogService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@Validated
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class ReferenceDataController {

    private final ReferenceCatalogService catalogService;

    @GetMapping("/form/policy")
    public ResponseEntity<FormPolicyResponse> formPolicy(
            @RequestParam(required = false) String usage,
            @RequestParam(required = false) String type,
            @RequestParam(required = false) String subtype) {
        return ResponseEntity.ok(catalogService.formPolicy(usage, type, subtype));
    }

    @GetMapping("/form/size-suggestion")
    public ResponseEntity<SizeSuggestionResponse> sizeSuggestion(
            @RequestParam @Min(0) @Max(50) int bedrooms) {
        return ResponseEntity.ok(catalogService.sizeSuggestion(bedrooms));
    }

    @GetMapping("/reference/areas")
    public ResponseEntity<AreaListResponse> areas() {
        return ResponseEntity.ok(catalogService.areas());
    }

    @GetMapping("/reference/property-types")
    public ResponseEntity<PropertyTypesResponse> propertyTypes() {
        return ResponseEntity.ok(catalogService.propertyTypes());
    }

    @GetMapping("/reference/registration-types")
    public ResponseEntity<RegistrationTypesResponse> registrationTypes() {
        return ResponseEntity.ok(catalogService.registrationTypes());
    }

    @GetMapping("/reference/validation-rules")
    public ResponseEntity<ValidationRulesResponse> validationRules() {
        return ResponseEntity.ok(catalogService.validationRules());
    }

    @PostMapping("/reference/reload")
    public ResponseEntity<ReloadResponse> reload(HttpServletRequest httpRequest) {
        String requestId = RequestIds.resolve(httpRequest);
        log.info("POST /reference/reload | requestId={}", requestId);
        return ResponseEntity.ok(catalogService.reload(requestId));
    }
}
