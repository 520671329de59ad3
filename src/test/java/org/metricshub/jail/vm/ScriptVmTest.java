package org.metricshub.jail.vm;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import javax.script.ScriptException;
import org.junit.Test;
import org.metricshub.jail.util.ScriptSource;
import org.mozilla.javascript.EvaluatorException;
import org.mozilla.javascript.Undefined;

public class ScriptVmTest {

	private final SandboxContextFactory factory = new SandboxContextFactory();

	@Test
	public void testRun() throws Exception {
		ScriptVm vm = new ScriptVm(factory);
		vm.run("var greeting = 'hello';");
		assertTrue(vm.has("greeting"));
		assertEquals("hello", vm.get("greeting"));
		assertEquals("2,4", String.valueOf(vm.run("[1, 2].map(x => x * 2).join(',')")));
	}

	@Test
	public void testNoJavaAccess() throws Exception {
		ScriptVm vm = new ScriptVm(factory);
		assertEquals("undefined", vm.run("typeof java"));
		assertEquals("undefined", vm.run("typeof Packages"));
		assertEquals("undefined", vm.run("typeof JavaImporter"));
	}

	@Test
	public void testVmsDoNotShareGlobals() throws Exception {
		ScriptVm first = new ScriptVm(factory);
		ScriptVm second = new ScriptVm(factory);
		first.run("var shared = 1;");
		assertFalse(second.has("shared"));
		assertEquals(Undefined.instance, second.get("shared"));
	}

	@Test
	public void testSyntaxError() {
		ScriptVm vm = new ScriptVm(factory);
		try {
			vm.run(new ScriptSource("broken.js", "var a = 1;\nvar b = ;"));
			fail("ScriptException expected");
		} catch (ScriptException e) {
			assertEquals("broken.js", e.getFileName());
			assertEquals(2, e.getLineNumber());
		}
	}

	@Test
	public void testCall() throws Exception {
		ScriptVm vm = new ScriptVm(factory);
		vm.run("function echo(path, args) { return path + ':' + args; }");
		assertEquals("a:[]", String.valueOf(vm.call("echo", "a", "[]")));
		try {
			vm.call("missing");
			fail("ScriptException expected");
		} catch (ScriptException e) {
			assertTrue(e.getMessage().contains("missing is not a function"));
		}
	}

	@Test
	public void testThrownError() throws Exception {
		ScriptVm vm = new ScriptVm(factory);
		vm.run("function fail() { throw new Error('nope'); }");
		try {
			vm.call("fail");
			fail("ScriptException expected");
		} catch (ScriptException e) {
			assertTrue(e.getMessage().contains("nope"));
		}
	}

	@Test
	public void testInvalidJsonIsScriptSyntaxError() throws Exception {
		ScriptVm vm = new ScriptVm(factory);
		try {
			vm.parseJson("{\"a\":");
			fail("EvaluatorException expected");
		} catch (EvaluatorException e) {
			assertTrue(e.getMessage().startsWith("SyntaxError"));
		}
		vm.set("values", vm.parseJson("[true,{\"b\":\"c\"}]"));
		assertEquals("c", vm.run("values[1].b"));
		assertEquals(Boolean.TRUE, vm.run("values[0]"));
	}

	@Test
	public void testJsonConversion() throws Exception {
		ScriptVm vm = new ScriptVm(factory);
		vm.set("parsed", vm.parseJson("{\"a\":[1,null,\"x\"]}"));
		assertEquals("{\"a\":[1,null,\"x\"]}", vm.stringify(vm.get("parsed")));
		assertNull(vm.stringify(Undefined.instance));
		assertNull(vm.stringify(vm.run("(function() {})")));
	}
}
