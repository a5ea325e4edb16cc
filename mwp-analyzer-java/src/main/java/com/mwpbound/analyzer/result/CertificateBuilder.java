package com.mwpbound.analyzer.result;

import com.mwpbound.analyzer.relation.Bound;
import com.mwpbound.analyzer.result.CertificateModel.*;

import java.util.*;

/**
 * Converts an AnalysisResult into the certificate model.
 * Functions are sorted by name and loops by function and ordinal, so equal analyses give equal output.
 */
public class CertificateBuilder {

    public CertRoot build(AnalysisResult result) {
        CertRoot root = new CertRoot();
        root.version = CertificateModel.VERSION;
        root.mode = result.getMode().name().toLowerCase(Locale.ROOT);
        root.timeMs = result.getTimeMillis();

        List<CertFunction> functions = new ArrayList<>();
        for (FunctionResult f : result.getFunctions()) functions.add(toCert(f));
        functions.sort(Comparator.comparing(f -> f.name));
        root.functions = functions;

        List<CertLoop> loops = new ArrayList<>();
        for (LoopResult l : result.getLoops()) loops.add(toCert(l));
        loops.sort(Comparator.comparing((CertLoop l) -> l.function).thenComparingInt(l -> l.ordinal));
        root.loops = loops;
        return root;
    }

    private CertFunction toCert(FunctionResult f) {
        CertFunction cert = new CertFunction();
        cert.name = f.name();
        cert.variables = f.variables();
        cert.index = f.index();
        cert.infinite = f.infinite();
        cert.relation = f.relation() != null ? f.relation().rows() : null;
        cert.choices = f.choices() != null ? f.choices().valid() : null;
        if (f.bounds() != null) {
            cert.bounds = new ArrayList<>();
            for (Map.Entry<String, Bound> e : f.bounds().entrySet()) {
                cert.bounds.add(toCert(e.getKey(), e.getValue()));
            }
        }
        cert.infinityFlows = f.infinityFlows();
        cert.timeMs = f.timeMillis();
        return cert;
    }

    private CertLoop toCert(LoopResult l) {
        CertLoop cert = new CertLoop();
        cert.function = l.function();
        cert.kind = l.kind();
        cert.ordinal = l.ordinal();
        cert.variables = new ArrayList<>();
        for (VariableResult v : l.variables().values()) {
            CertVariable cv = new CertVariable();
            cv.name = v.name();
            if (v.isBounded()) {
                cv.growth = v.growth().symbol();
                cv.choices = v.choices().valid();
                cv.bound = toCert(v.name(), v.bound());
            }
            cert.variables.add(cv);
        }
        cert.timeMs = l.timeMillis();
        return cert;
    }

    private CertBound toCert(String variable, Bound bound) {
        CertBound cert = new CertBound();
        cert.variable = variable;
        cert.bound = bound.toString();
        cert.x = bound.maxVariables();
        cert.y = bound.weakVariables();
        cert.z = bound.polyVariables();
        return cert;
    }
}
