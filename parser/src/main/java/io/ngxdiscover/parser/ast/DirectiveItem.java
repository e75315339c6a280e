package io.ngxdiscover.parser.ast;

import java.util.List;
import java.util.Objects;

/** The content of a directive: a terminated statement or a block with children. */
public sealed interface DirectiveItem permits DirectiveItem.Simple, DirectiveItem.Block {

  String name();

  List<Value> args();

  /** {@code name args... ;} */
  record Simple(String name, List<Value> args) implements DirectiveItem {
    public Simple {
      Objects.requireNonNull(name, "name");
      args = args == null ? List.of() : List.copyOf(args);
    }
  }

  /** {@code name args... { children }} */
  record Block(String name, List<Value> args, List<Directive> children) implements DirectiveItem {
    public Block {
      Objects.requireNonNull(name, "name");
      args = args == null ? List.of() : List.copyOf(args);
      children = children == null ? List.of() : List.copyOf(children);
    }
  }
}
