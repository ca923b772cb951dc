package com.kuzur.script.parser;

import java.util.List;

import com.kuzur.script.errors.ArityError;
import com.kuzur.script.errors.ControlFlowError;
import com.kuzur.script.parser.Interpreter.BreakSignal;
import com.kuzur.script.parser.Interpreter.ContinueSignal;
import com.kuzur.script.parser.Interpreter.ReturnSignal;
import com.kuzur.script.parser.Statement.Block;

/** A {@code func} declaration closed over the environment it was declared in. */
public class UserFunction implements KuzurCallable {
    final String name;
    final List<Token> params;
    final Block body;
    final Environment closure;

    UserFunction(String name, List<Token> params, Block body, Environment closure) {
        this.name = name;
        this.params = params;
        this.body = body;
        this.closure = closure;
    }

    @Override
    public String name() { return name; }

    @Override
    public Value call(Interpreter interpreter, List<Value> args) {
        if (args.size() != params.size()) {
            throw new ArityError("%s() expects %d argument(s), got %d", name, params.size(), args.size());
        }

        Environment previous = interpreter.env;

        // New call frame is a child of the function's closure (lexical scoping),
        // not of the caller's environment.
        interpreter.env = closure.callFrame();

        try {
            for (int i = 0; i < params.size(); i++) {
                interpreter.env.define(params.get(i).lexeme, args.get(i));
            }

            try {
                interpreter.executeBlock(body);
            } catch (ReturnSignal rs) {
                return rs.value;
            }

            return Value.nil();
        } catch (BreakSignal bs) {
            throw new ControlFlowError("'break' outside loop").at(bs.keyword.line, bs.keyword.column);
        } catch (ContinueSignal cs) {
            throw new ControlFlowError("'continue' outside loop").at(cs.keyword.line, cs.keyword.column);
        } finally {
            interpreter.env = previous;
        }
    }

    @Override
    public String toString() { return "<func " + name + ">"; }
}
