package work.lcod.crosscheck.cli;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.crosscheck.mapping.TableConsistency;
import work.lcod.crosscheck.normalize.CandidateNormalizer;
import work.lcod.crosscheck.normalize.ReferenceNormalizer;

@CommandLine.Command(
    name = "check-tables",
    description = "Verify the mapping tables, optionally against a grammar's node-types.json.",
    mixinStandardHelpOptions = true
)
final class CheckTablesCommand implements Callable<Integer> {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
        names = "--node-types",
        description = "tree-sitter node-types.json to check grammar coverage against.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path nodeTypes;

    @Override
    public Integer call() {
        var problems = new ArrayList<>(TableConsistency.verify(
            CandidateNormalizer.SYNTHESIZED, new ReferenceNormalizer().synthesizedKinds()));
        if (nodeTypes != null) {
            problems.addAll(TableConsistency.verifyNodeTypes(nodeTypes));
        }
        var err = spec.commandLine().getErr();
        if (problems.isEmpty()) {
            err.println("Mapping tables are consistent.");
            return 0;
        }
        for (var problem : problems) {
            err.println(spec.commandLine().getColorScheme().errorText(problem));
        }
        err.println(problems.size() + " problem(s) found.");
        return 1;
    }
}
