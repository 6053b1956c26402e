package org.ardugen.benchmark;

import java.util.List;
import java.util.concurrent.TimeUnit;

import org.ardugen.ArduinoMathGenerator;
import org.ardugen.EmitterOptions;
import org.ardugen.benchmark.domain.SampleTrees;
import org.ardugen.emitter.EmissionResult;
import org.ardugen.session.GenerationSession;
import org.ardugen.session.HelperDefinition;
import org.ardugen.tree.OperationNode;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;

/**
 * Measures emission of whole trees. Each invocation starts a fresh session, as a program
 * assembler does per sketch, except for {@code emitHelperHeavyWarmSession} which reuses one
 * session so that every helper request is a table hit.
 */
@BenchmarkMode({Mode.AverageTime, Mode.Throughput})
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@Fork(value = 2)
@Warmup(iterations = 5, time = 2)
@Measurement(iterations = 5, time = 2)
public class EmissionBenchmark {

    @State(Scope.Thread)
    public static class DeepArithmeticState {

        @Param({"4", "8", "12"})
        int depth;

        ArduinoMathGenerator generator;
        OperationNode tree;

        @Setup(Level.Trial)
        public void build() {
            generator = new ArduinoMathGenerator(EmitterOptions.defaults());
            tree = SampleTrees.deepArithmetic(depth, 42L);
        }
    }

    @State(Scope.Thread)
    public static class HelperHeavyState {

        ArduinoMathGenerator generator;
        OperationNode tree;
        GenerationSession warmSession;

        @Setup(Level.Trial)
        public void build() {
            generator = new ArduinoMathGenerator(EmitterOptions.defaults());
            tree = SampleTrees.helperHeavy();
            warmSession = generator.newSession();
            generator.expression(tree, warmSession);
        }
    }

    @Benchmark
    public EmissionResult emitDeepArithmetic(DeepArithmeticState state) {
        return state.generator.expression(state.tree, state.generator.newSession());
    }

    @Benchmark
    public void emitHelperHeavy(HelperHeavyState state, Blackhole blackhole) {
        GenerationSession session = state.generator.newSession();
        blackhole.consume(state.generator.statement(state.tree, session));
        List<HelperDefinition> helpers = session.drainDefinitions();
        blackhole.consume(helpers);
    }

    @Benchmark
    public EmissionResult emitHelperHeavyWarmSession(HelperHeavyState state) {
        return state.generator.expression(state.tree, state.warmSession);
    }
}
