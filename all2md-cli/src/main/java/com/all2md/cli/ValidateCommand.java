package com.all2md.cli;

import java.util.List;

import com.all2md.core.ast.Document;
import com.all2md.core.config.All2MdConfig;
import com.all2md.core.visitor.ValidatingVisitor;
import com.all2md.core.visitor.ValidationFinding;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Validates a document's tree and prints every finding.
 *
 * <p>Exits with 1 when at least one finding is an error, 0 otherwise.
 */
@Command(
    name = "validate",
    description = "Check a document for structural problems",
    mixinStandardHelpOptions = true
)
public class ValidateCommand extends DocumentCommand {

    @Option(names = {"--allow-html"}, description = "Accept raw HTML blocks and inlines (overrides config)")
    private boolean allowHtml;

    @Override
    protected int execute(Document document, All2MdConfig config) {
        boolean allowRawHtml = allowHtml || config.validation().allowRawHtml();
        List<ValidationFinding> findings = new ValidatingVisitor(allowRawHtml).validate(document);

        if (findings.isEmpty()) {
            System.out.println("✓ " + inputFile + ": no problems found");
            return 0;
        }
        findings.forEach(finding -> System.out.println("  " + finding));
        long errors = findings.stream().filter(ValidationFinding::isError).count();
        System.out.printf("%s: %d error(s), %d warning(s)%n", inputFile, errors, findings.size() - errors);
        return errors > 0 ? 1 : 0;
    }

    @Override
    protected String commandName() {
        return "validate";
    }
}
