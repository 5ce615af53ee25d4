package utilities;

import algorithms.BadCharTables;
import org.openjdk.jol.info.GraphLayout;
import org.openjdk.jol.vm.VM;
import tree.FactorTrie;

import java.util.Locale;

public class MemUtil {

    // Retained size of a freshly built trie, optionally with the per-class footprint table.
    public MemoryUsageReport jolTrieReport(FactorTrie trie, boolean includeFootprintTable) {
        return report("FactorTrie (l=" + trie.factorLength() + ", nodes=" + trie.nodeCount()
                + ", positions=" + trie.positionCount() + ")", trie, includeFootprintTable);
    }

    public MemoryUsageReport jolTablesReport(BadCharTables tables, boolean includeFootprintTable) {
        int sigma = tables.alphabet().size();
        return report("BadCharTables (" + sigma + "x" + sigma + " x2)", tables, includeFootprintTable);
    }

    public String vmDetails() {
        return VM.current().details();
    }

    private MemoryUsageReport report(String title, Object root, boolean includeFootprintTable) {
        StringBuilder sb = new StringBuilder(2048);
        GraphLayout layout = GraphLayout.parseInstance(root);
        long totalBytes = layout.totalSize();
        double totalMiB = totalBytes / (1024.0 * 1024.0);

        sb.append("=== ").append(title).append(" ===\n");
        sb.append("Total bytes       : ").append(totalBytes).append(" B\n");
        sb.append("Total bytes (MiB) : ")
                .append(String.format(Locale.ROOT, "%.3f", totalMiB))
                .append(" MiB\n");
        if (includeFootprintTable) {
            sb.append(layout.toFootprint()).append('\n');
        }
        return new MemoryUsageReport(sb.toString(), totalMiB);
    }
}
