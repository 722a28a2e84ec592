package hypertag.frontend.tree;

import java.util.List;

import hypertag.ast.HypertagAST;
import hypertag.ast.NodeKind;

/**
 * [from PATH] import item, item...
 */
public class ImportBlock {
  /** Module path, or null to import from the default context module */
  private final String path;
  private final List<HypertagAST> items;

  private ImportBlock(String path, List<HypertagAST> items) {
    this.path = path;
    this.items = items;
  }

  public String getPath() {
    return path;
  }

  public List<HypertagAST> getItems() {
    return items;
  }

  public static ImportBlock fromAST(HypertagAST tree) {
    assert(tree.getKind() == NodeKind.BLOCK_IMPORT);
    HypertagAST first = tree.child(0);
    if (first.getKind() == NodeKind.PATH_IMPORT) {
      return new ImportBlock((String) first.getValue(), tree.children(1));
    }
    return new ImportBlock(null, tree.children());
  }

  /** Symbol being imported, with its % or $ prefix */
  public static String importedSymbol(HypertagAST item) {
    return (String) item.child(0).getValue();
  }

  /** Symbol the import is bound to: the alias if given */
  public static String boundSymbol(HypertagAST item) {
    String symbol = importedSymbol(item);
    if (item.childCount() == 2) {
      return symbol.charAt(0) + item.child(1).getName();
    }
    return symbol;
  }
}
