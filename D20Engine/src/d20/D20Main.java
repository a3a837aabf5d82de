package d20;

import java.util.Arrays;
import java.util.Map;

import com.google.common.base.Joiner;
import com.google.common.base.Strings;

public class D20Main {

  private static final int BAR_WIDTH = 50;

  public static void main(String[] args) {
    if (args.length < 2 || !(args[0].equals("roll") || args[0].equals("dist"))) {
      System.err.println("Usage: $D20 roll|dist expression...");
      System.exit(1);
    }

    String text = Joiner.on(' ').join(Arrays.asList(args).subList(1, args.length));
    try {
      if (args[0].equals("roll")) {
        printRoll(DiceNotation.roll(text));
      } else {
        printDistribution(DiceNotation.distribution(text));
      }
    } catch (DiceException ex) {
      ex.print();
      System.exit(1);
    }
  }

  private static void printRoll(RolledExpression rolled) {
    System.out.println(rolled.expression());
    System.out.println(String.format("%s = %s", rolled, Expression.formatNumber(rolled.total())));
  }

  private static void printDistribution(Distribution distribution) {
    double highest = distribution.asMap().values().stream().mapToDouble(d -> d).max().orElse(1);
    for (Map.Entry<Double, Double> entry : distribution.asMap().entrySet()) {
      int bar = (int) Math.round(BAR_WIDTH * entry.getValue() / highest);
      System.out.println(
          String.format(
              "%8s %7.3f%% %s",
              Expression.formatNumber(entry.getKey()),
              100 * entry.getValue(),
              Strings.repeat("#", bar)));
    }
    System.out.println(
        String.format("mean %.4f, stddev %.4f", distribution.mean(), distribution.stddev()));
  }
}
