package com.mwpbound.analyzer.analysis;

import com.mwpbound.analyzer.config.AnalysisConfig;
import com.mwpbound.analyzer.config.AnalysisMode;
import com.mwpbound.analyzer.lang.FunctionDef;
import com.mwpbound.analyzer.lang.Program;
import com.mwpbound.analyzer.result.AnalysisResult;
import com.mwpbound.analyzer.result.LoopResult;

import java.util.Optional;

/**
 * Orchestrates the analysis of a program.
 * Runs either function analysis or loop analysis over every function, as configured.
 */
public class MwpAnalyzer {

    public AnalysisResult analyze(Program program, AnalysisConfig config) {
        Analyzer analyzer = new Analyzer(config);
        AnalysisResult result = new AnalysisResult(config.getMode()).onStart();

        if (config.getMode() == AnalysisMode.LOOP) {
            LoopAnalyzer loopAnalyzer = new LoopAnalyzer(analyzer);
            for (FunctionDef function : program.functions()) {
                for (LoopResult loop : loopAnalyzer.analyze(function, config.isStrict())) {
                    result.addLoop(loop);
                }
            }
        } else {
            for (FunctionDef function : program.functions()) {
                Optional<FunctionDef> checked = analyzer.syntaxCheck(function, config.isStrict());
                if (checked.isPresent()) {
                    result.addFunction(analyzer.analyzeFunction(checked.get(), !config.isFin()));
                }
            }
        }

        result.onEnd().logResult();
        return result;
    }
}
