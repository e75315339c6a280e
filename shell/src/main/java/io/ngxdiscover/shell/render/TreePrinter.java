package io.ngxdiscover.shell.render;

import io.ngxdiscover.parser.ast.Config;
import io.ngxdiscover.parser.ast.Directive;
import io.ngxdiscover.shell.OutputWriter;
import java.util.List;

/** Prints the directive tree of a configuration with box-drawing branches. */
public final class TreePrinter {
  private TreePrinter() {}

  public static void print(Config config, OutputWriter out) {
    out.println("Configuration Tree:");
    out.println("");
    print(config.directives(), 0, out);
  }

  private static void print(List<Directive> directives, int depth, OutputWriter out) {
    for (int i = 0; i < directives.size(); i++) {
      Directive d = directives.get(i);
      String indent = "  ".repeat(depth);
      String prefix = i == directives.size() - 1 ? "└─ " : "├─ ";
      String head = render(d);
      if (d.isBlock()) {
        out.println(indent + prefix + head + " {");
        print(d.children(), depth + 1, out);
        out.println(indent + "   }");
      } else {
        out.println(indent + prefix + head + ";");
      }
    }
  }

  static String render(Directive d) {
    List<String> args = d.argsAsStrings();
    return args.isEmpty() ? d.name() : d.name() + " " + String.join(" ", args);
  }
}
