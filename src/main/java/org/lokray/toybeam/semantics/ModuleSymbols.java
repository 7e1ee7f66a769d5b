package org.lokray.toybeam.semantics;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The module-level symbol table: function names with their arities, and struct and enum
 * names with their field and variant arities. Filled once by {@link SemanticAnalyzer}
 * and only read afterwards.
 * <p>
 * The predeclared {@code Signal} enum describes the runtime's exit and monitor notifications
 * and is present in every module.
 */
public class ModuleSymbols
{
	public static final String SIGNAL_ENUM = "Signal";

	private final String moduleName;
	private final Map<String, FunctionSymbol> functions = new LinkedHashMap<>();
	private final Map<String, StructSymbol> structs = new LinkedHashMap<>();
	private final Map<String, EnumSymbol> enums = new LinkedHashMap<>();

	ModuleSymbols(String moduleName)
	{
		this.moduleName = moduleName;

		EnumSymbol signal = new EnumSymbol(SIGNAL_ENUM, null);
		signal.addVariant(new VariantSymbol(SIGNAL_ENUM, "EXIT", 2, null));  // {'EXIT', Pid, Reason}
		signal.addVariant(new VariantSymbol(SIGNAL_ENUM, "DOWN", 4, null));  // {'DOWN', Ref, process, Pid, Reason}
		enums.put(SIGNAL_ENUM, signal);
	}

	void defineFunction(FunctionSymbol function)
	{
		functions.put(function.getName(), function);
	}

	void defineStruct(StructSymbol struct)
	{
		structs.put(struct.getName(), struct);
	}

	void defineEnum(EnumSymbol enumSymbol)
	{
		enums.put(enumSymbol.getName(), enumSymbol);
	}

	public String getModuleName()
	{
		return moduleName;
	}

	public FunctionSymbol getFunction(String name)
	{
		return functions.get(name);
	}

	public Collection<FunctionSymbol> getFunctions()
	{
		return Collections.unmodifiableCollection(functions.values());
	}

	/**
	 * The public functions in declaration order; exactly the module's export list.
	 */
	public List<FunctionSymbol> getExports()
	{
		List<FunctionSymbol> exports = new ArrayList<>();
		for (FunctionSymbol function : functions.values())
		{
			if (function.isPublic())
			{
				exports.add(function);
			}
		}
		return exports;
	}

	public StructSymbol getStruct(String name)
	{
		return structs.get(name);
	}

	public Collection<StructSymbol> getStructs()
	{
		return Collections.unmodifiableCollection(structs.values());
	}

	public EnumSymbol getEnum(String name)
	{
		return enums.get(name);
	}

	/**
	 * All enums, the predeclared ones first.
	 */
	public Collection<EnumSymbol> getEnums()
	{
		return Collections.unmodifiableCollection(enums.values());
	}

	public boolean isEnum(String name)
	{
		return enums.containsKey(name);
	}

	public boolean isType(String name)
	{
		return structs.containsKey(name) || enums.containsKey(name);
	}

	/**
	 * Every struct that declares the field, in declaration order.
	 */
	public List<StructSymbol> structsWithField(String field)
	{
		List<StructSymbol> owners = new ArrayList<>();
		for (StructSymbol struct : structs.values())
		{
			if (struct.hasField(field))
			{
				owners.add(struct);
			}
		}
		return owners;
	}

	@Override
	public String toString()
	{
		return "ModuleSymbols{" + moduleName + ", functions=" + functions.values()
				+ ", structs=" + structs.values() + ", enums=" + enums.values() + "}";
	}
}
