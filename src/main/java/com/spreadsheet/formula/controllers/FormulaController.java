package com.spreadsheet.formula.controllers;

import com.spreadsheet.formula.exceptions.InvalidRequestException;
import com.spreadsheet.formula.models.CycleReferenceRequest;
import com.spreadsheet.formula.models.TranslateRequest;
import com.spreadsheet.formula.parser.ReferenceAdjuster;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Collections;
import java.util.Map;

/**
 * Stateless formula text utilities used by the editor.
 * "/formula" is the base path.
 */
@RestController
@RequestMapping("/formula")
public class FormulaController {

    @Autowired
    private ReferenceAdjuster referenceAdjuster;

    /**
     * POST /formula/translate
     * Body: { "formula": "=A1+$B$1", "rowDelta": 1, "colDelta": 2 }
     * Returns the formula as it reads after being pasted that far away: { "formula": "=C2+$B$1" }.
     */
    @PostMapping("/translate")
    public ResponseEntity<Map<String, String>> translate(@RequestBody TranslateRequest request) {
        String formula = requireFormula(request.getFormula());
        String translated = referenceAdjuster.translateFormula(formula, request.getRowDelta(), request.getColDelta());
        return ResponseEntity.ok(Collections.singletonMap("formula", translated));
    }

    /**
     * POST /formula/cycle-reference
     * Body: { "formula": "=A1+B1", "cursorOffset": 2 }
     * Applies the F4 toggle to the reference under the cursor: { "formula": "=$A$1+B1" }.
     */
    @PostMapping("/cycle-reference")
    public ResponseEntity<Map<String, String>> cycleReference(@RequestBody CycleReferenceRequest request) {
        String formula = requireFormula(request.getFormula());
        // -1 never lands on a reference, so everything cycles
        int cursor = request.getCursorOffset() == null ? -1 : request.getCursorOffset();
        return ResponseEntity.ok(Collections.singletonMap("formula", referenceAdjuster.cycleReferenceAt(formula, cursor)));
    }

    private static String requireFormula(String formula) {
        if (formula == null) {
            throw new InvalidRequestException("Missing field 'formula'");
        }
        return formula;
    }
}
