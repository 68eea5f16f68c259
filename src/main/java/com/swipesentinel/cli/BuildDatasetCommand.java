package com.swipesentinel.cli;

import com.swipesentinel.audit.PacketLogger;
import com.swipesentinel.core.ConfigException;
import com.swipesentinel.model.Packet;
import com.swipesentinel.model.ScreenType;
import com.swipesentinel.regression.DatasetBuilder;
import com.swipesentinel.regression.RegressionCase;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/** Turns a session's packet log into a regression dataset. */
@Command(name = "build-dataset", description = "Build a regression dataset from a packet log")
class BuildDatasetCommand extends SwipeSentinelCommand {

    @Option(names = "--packets", required = true, description = "Packet log JSONL written by a session")
    private Path packets;

    @Option(names = {"-o", "--out"}, required = true, description = "Dataset JSONL to write")
    private Path out;

    @Option(names = "--screen-types", split = ",", description = "Keep only these screen types, e.g. discover_card,chat_thread")
    private List<String> screenTypes = List.of();

    @Option(names = "--max-rows", description = "At most this many cases (default: 200)")
    private int maxRows = 200;

    @Option(names = "--nl-query", description = "Instruction stored on every case (default: the one each packet was recorded under)")
    private String nlQuery;

    @Override
    protected int execute() {
        if (maxRows <= 0) throw new ConfigException("--max-rows must be > 0");
        Set<ScreenType> filter = EnumSet.noneOf(ScreenType.class);
        for (String raw : screenTypes) {
            try {
                filter.add(ScreenType.fromWire(raw));
            } catch (IllegalArgumentException e) {
                throw new ConfigException(e.getMessage(), e);
            }
        }

        List<Packet> logged = PacketLogger.readAll(packets);
        DatasetBuilder builder = new DatasetBuilder();
        List<RegressionCase> cases = builder.build(logged, filter, maxRows, nlQuery);
        if (cases.isEmpty()) {
            System.err.println("[EMPTY] No packet in " + packets + " carried a decision matching the filter");
            return EXIT_FAILED;
        }
        builder.write(out, cases);
        System.out.printf("Wrote %d case(s) to %s%n", cases.size(), out);
        return EXIT_OK;
    }
}
