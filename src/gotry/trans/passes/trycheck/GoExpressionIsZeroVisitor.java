package gotry.trans.passes.trycheck;

import gotry.model.golang.*;
import gotry.model.golang.type.GoType;

import java.math.BigInteger;

/**
 * Decides whether an expression spells a zero value. Only literal forms are recognized; anything that would need
 * type information is not zero.
 */
public class GoExpressionIsZeroVisitor extends GoExpressionVisitor<Boolean, RuntimeException> {

	static boolean isZeroInt(String text) {
		String digits = text.replace("_", "").toLowerCase();
		int radix = 10;
		if (digits.startsWith("0x")) {
			radix = 16;
			digits = digits.substring(2);
		} else if (digits.startsWith("0o")) {
			radix = 8;
			digits = digits.substring(2);
		} else if (digits.startsWith("0b")) {
			radix = 2;
			digits = digits.substring(2);
		} else if (digits.length() > 1 && digits.startsWith("0")) {
			radix = 8;
			digits = digits.substring(1);
		}
		try {
			return new BigInteger(digits, radix).signum() == 0;
		} catch (NumberFormatException e) {
			return false;
		}
	}

	static boolean isZeroFloat(String text) {
		String digits = text.replace("_", "");
		String lower = digits.toLowerCase();
		// Double.parseDouble requires an exponent on hexadecimal floats
		if (lower.startsWith("0x") && !lower.contains("p")) {
			digits = digits + "p0";
		}
		try {
			return Double.parseDouble(digits) == 0.0;
		} catch (NumberFormatException e) {
			return false;
		}
	}

	@Override
	public Boolean visit(GoVariableName v) throws RuntimeException {
		return v.getName().equals(GoBuiltins.NIL);
	}

	@Override
	public Boolean visit(GoBuiltins.BuiltinConstant v) throws RuntimeException {
		return false;
	}

	@Override
	public Boolean visit(GoIntLiteral intLiteral) throws RuntimeException {
		return isZeroInt(intLiteral.getText());
	}

	@Override
	public Boolean visit(GoFloatLiteral floatLiteral) throws RuntimeException {
		return isZeroFloat(floatLiteral.getText());
	}

	@Override
	public Boolean visit(GoImaginaryLiteral imaginaryLiteral) throws RuntimeException {
		String text = imaginaryLiteral.getText();
		if (!text.endsWith("i")) {
			return false;
		}
		String value = text.substring(0, text.length() - 1);
		return isZeroInt(value) || isZeroFloat(value);
	}

	@Override
	public Boolean visit(GoRuneLiteral runeLiteral) throws RuntimeException {
		// only the bare text 0 counts; quoted spellings such as '\x00' are not recognized
		return runeLiteral.getText().equals("0");
	}

	@Override
	public Boolean visit(GoStringLiteral stringLiteral) throws RuntimeException {
		String text = stringLiteral.getText();
		return text.equals("\"\"") || text.equals("``");
	}

	@Override
	public Boolean visit(GoCompositeLiteral compositeLiteral) throws RuntimeException {
		return compositeLiteral.getElements().isEmpty();
	}

	@Override
	public Boolean visit(GoKeyValue keyValue) throws RuntimeException {
		return false;
	}

	@Override
	public Boolean visit(GoParenthesized parenthesized) throws RuntimeException {
		return false;
	}

	@Override
	public Boolean visit(GoSelectorExpression dot) throws RuntimeException {
		return false;
	}

	@Override
	public Boolean visit(GoIndexExpression index) throws RuntimeException {
		return false;
	}

	@Override
	public Boolean visit(GoSliceOperator slice) throws RuntimeException {
		return false;
	}

	@Override
	public Boolean visit(GoTypeAssertion typeAssertion) throws RuntimeException {
		return false;
	}

	@Override
	public Boolean visit(GoAnonymousFunction anonymousFunction) throws RuntimeException {
		return false;
	}

	@Override
	public Boolean visit(GoCall call) throws RuntimeException {
		return false;
	}

	@Override
	public Boolean visit(GoBinop binop) throws RuntimeException {
		return false;
	}

	@Override
	public Boolean visit(GoUnary unary) throws RuntimeException {
		return false;
	}

	@Override
	public Boolean visit(GoEllipsis ellipsis) throws RuntimeException {
		return false;
	}

	@Override
	public Boolean visit(GoType type) throws RuntimeException {
		return false;
	}
}
