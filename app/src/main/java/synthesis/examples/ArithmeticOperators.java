package synthesis.examples;

import static synthesis.eval.TreeEvaluator.isIntegral;

import com.google.common.math.LongMath;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.DoubleBinaryOperator;
import java.util.function.DoubleUnaryOperator;
import java.util.function.LongBinaryOperator;
import synthesis.ast.Node;
import synthesis.eval.EvaluationException;
import synthesis.eval.Operator;

/**
 * Integer/floating point operator table for {@link synthesis.eval.TreeEvaluator}.
 *
 * <p>Integral operands use exact {@code long} arithmetic, anything else falls back to {@code
 * double}. Overflow, division by zero and domain errors raise {@link ArithmeticException};
 * non-numeric operands or a wrong argument count raise {@link EvaluationException}.
 */
public final class ArithmeticOperators {

  private ArithmeticOperators() {}

  public static Map<String, Operator> standard() {
    Map<String, Operator> ops = new LinkedHashMap<>();
    ops.put("add", binary(Math::addExact, (x, y) -> x + y));
    ops.put("sub", binary(Math::subtractExact, (x, y) -> x - y));
    ops.put("mul", binary(Math::multiplyExact, (x, y) -> x * y));
    ops.put("div", ArithmeticOperators::trueDivide);
    ops.put(
        "floordiv",
        binary(ArithmeticOperators::floorDivideExact, ArithmeticOperators::floorDivide));
    ops.put("shl", ArithmeticOperators::shiftLeft);
    ops.put("shr", ArithmeticOperators::shiftRight);
    ops.put("pow", ArithmeticOperators::power);
    ops.put("ln", unary(ArithmeticOperators::ln));
    ops.put("exp", unary(ArithmeticOperators::exp));
    ops.put(
        "lt",
        (node, args) -> {
          checkArity(node, args, 2);
          return compare(node, args.get(0), args.get(1)) < 0 ? 1L : 0L;
        });
    ops.put(
        "ge",
        (node, args) -> {
          checkArity(node, args, 2);
          return compare(node, args.get(0), args.get(1)) >= 0 ? 1L : 0L;
        });
    ops.put(
        "ite",
        (node, args) -> {
          checkArity(node, args, 3);
          return isTruthy(args.get(0)) ? args.get(1) : args.get(2);
        });
    return Map.copyOf(ops);
  }

  static boolean isTruthy(Object value) {
    if (value instanceof Number n) {
      return isIntegral(n) ? n.longValue() != 0L : n.doubleValue() != 0.0;
    }
    if (value instanceof Boolean b) {
      return b;
    }
    if (value instanceof String s) {
      return !s.isEmpty();
    }
    return value != null;
  }

  private static Operator binary(LongBinaryOperator longs, DoubleBinaryOperator doubles) {
    return (node, args) -> {
      checkArity(node, args, 2);
      Number x = number(node, args.get(0));
      Number y = number(node, args.get(1));
      if (isIntegral(x) && isIntegral(y)) {
        return longs.applyAsLong(x.longValue(), y.longValue());
      }
      return doubles.applyAsDouble(x.doubleValue(), y.doubleValue());
    };
  }

  private static Operator unary(DoubleUnaryOperator fn) {
    return (node, args) -> {
      checkArity(node, args, 1);
      return fn.applyAsDouble(number(node, args.get(0)).doubleValue());
    };
  }

  private static Object trueDivide(Node node, List<Object> args) {
    checkArity(node, args, 2);
    double x = number(node, args.get(0)).doubleValue();
    double y = number(node, args.get(1)).doubleValue();
    if (y == 0.0) {
      throw new ArithmeticException("division by zero");
    }
    return x / y;
  }

  private static long floorDivideExact(long x, long y) {
    if (x == Long.MIN_VALUE && y == -1L) {
      throw new ArithmeticException("long overflow");
    }
    return Math.floorDiv(x, y);
  }

  private static double floorDivide(double x, double y) {
    if (y == 0.0) {
      throw new ArithmeticException("division by zero");
    }
    return Math.floor(x / y);
  }

  private static Object shiftLeft(Node node, List<Object> args) {
    checkArity(node, args, 2);
    long x = integral(node, args.get(0));
    long count = shiftCount(node, args.get(1));
    if (x == 0L) {
      return 0L;
    }
    if (count >= Long.SIZE || (x << count) >> count != x) {
      throw new ArithmeticException("long overflow");
    }
    return x << count;
  }

  private static Object shiftRight(Node node, List<Object> args) {
    checkArity(node, args, 2);
    long x = integral(node, args.get(0));
    long count = shiftCount(node, args.get(1));
    if (count >= Long.SIZE) {
      return x < 0 ? -1L : 0L;
    }
    return x >> count;
  }

  private static Object power(Node node, List<Object> args) {
    checkArity(node, args, 2);
    Number base = number(node, args.get(0));
    Number exponent = number(node, args.get(1));
    if (isIntegral(base) && isIntegral(exponent) && exponent.longValue() >= 0) {
      long e = exponent.longValue();
      if (e > Integer.MAX_VALUE) {
        throw new ArithmeticException("exponent too large: " + e);
      }
      return LongMath.checkedPow(base.longValue(), (int) e);
    }
    if (base.doubleValue() == 0.0 && exponent.doubleValue() < 0) {
      throw new ArithmeticException("zero cannot be raised to a negative power");
    }
    return Math.pow(base.doubleValue(), exponent.doubleValue());
  }

  private static double ln(double x) {
    if (x <= 0.0) {
      throw new ArithmeticException("math domain error");
    }
    return Math.log(x);
  }

  private static double exp(double x) {
    double result = Math.exp(x);
    if (Double.isInfinite(result)) {
      throw new ArithmeticException("math range error");
    }
    return result;
  }

  private static int compare(Node node, Object a, Object b) {
    Number x = number(node, a);
    Number y = number(node, b);
    if (isIntegral(x) && isIntegral(y)) {
      return Long.compare(x.longValue(), y.longValue());
    }
    return Double.compare(x.doubleValue(), y.doubleValue());
  }

  private static long shiftCount(Node node, Object raw) {
    long count = integral(node, raw);
    if (count < 0) {
      throw new ArithmeticException("negative shift count");
    }
    return count;
  }

  private static long integral(Node node, Object raw) {
    Number n = number(node, raw);
    if (!isIntegral(n)) {
      throw new EvaluationException(node.name() + " expects integer operands, got " + raw);
    }
    return n.longValue();
  }

  private static Number number(Node node, Object raw) {
    if (raw instanceof Number n) {
      return n;
    }
    throw new EvaluationException(node.name() + " expects numeric operands, got " + raw);
  }

  private static void checkArity(Node node, List<Object> args, int expected) {
    if (args.size() != expected) {
      throw new EvaluationException(
          node.name() + " expects " + expected + " argument(s), got " + args.size());
    }
  }
}
