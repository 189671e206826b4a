package com.example.agreement.interfaces.api;

import com.example.agreement.application.model.AgreementSettings;
import com.example.agreement.application.service.AgreementPlaceholderService;
import com.example.agreement.config.AgreementProperties;
import com.example.agreement.domain.model.DatasetRecord;
import com.example.agreement.interfaces.api.dto.PlaceholderRequest;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.ResponseBody;

import java.util.Map;

/**
 * Interfaces-layer controller that returns the agreement placeholders of a posted dataset description.
 * The request body stands in for the metadata and identity services.
 */
@Controller
public class AgreementPlaceholderController {

    private final AgreementPlaceholderService placeholderService;
    private final AgreementProperties properties;

    /**
     * Creates the controller with the required application service.
     *
     * @param placeholderService service assembling the placeholders
     * @param properties         bound {@code agreement.*} settings locating the template resources
     */
    public AgreementPlaceholderController(AgreementPlaceholderService placeholderService,
                                          AgreementProperties properties) {
        this.placeholderService = placeholderService;
        this.properties = properties;
    }

    /**
     * REST endpoint producing the substitution context of an agreement.
     *
     * @param request dataset, depositor and file description
     * @return JSON object mapping template keys to their values
     */
    @PostMapping(value = "/api/placeholders",
            consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    @ResponseBody
    public ResponseEntity<Map<String, Object>> createPlaceholders(@RequestBody PlaceholderRequest request) {
        DatasetRecord dataset = request.toDatasetRecord();
        AgreementSettings settings = new AgreementSettings(
                properties.templateResourceDir(),
                request.datasetId(),
                request.sample(),
                datasetId -> dataset,
                depositorId -> request.depositor()
        );
        return ResponseEntity.ok(placeholderService.createPlaceholders(settings));
    }
}
