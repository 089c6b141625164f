/*******************************************************************************
 * BWTSearch - Wildcard substring search over Burrows-Wheeler indexes
 * Copyright 2026 The BWTSearch contributors
 *
 * This file is part of BWTSearch.
 *
 *     BWTSearch is free software: you can redistribute it and/or modify
 *     it under the terms of the GNU General Public License as published by
 *     the Free Software Foundation, either version 3 of the License, or
 *     (at your option) any later version.
 *
 *     BWTSearch is distributed in the hope that it will be useful,
 *     but WITHOUT ANY WARRANTY; without even the implied warranty of
 *     MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 *     GNU General Public License for more details.
 *
 *     You should have received a copy of the GNU General Public License
 *     along with BWTSearch.  If not, see <http://www.gnu.org/licenses/>.
 *******************************************************************************/
package bwtsearch.main;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;

/**
 * Option of a command. The value given by the user is decoded according to the option type
 * and assigned through the setter of the attribute with the same name in the program
 */
public class CommandOption {

	public enum Type {
		/** Path of an input or output file. Setter receives a String */
		FILE,
		/** Single character such as the wildcard or the terminator. Setter receives a char */
		SYMBOL,
		/** Name of a constant of the enum received by the setter, ignoring case */
		ENUM,
		/** Option without value. Setter receives a boolean which is set to true */
		FLAG
	}

	private final String id;
	private final Type type;
	private final String attribute;
	private final String description;
	private String defaultValue;

	public CommandOption(String id, Type type, String attribute, String description) {
		this.id = id;
		this.type = type;
		this.attribute = attribute;
		this.description = description;
	}
	public String getId() {
		return id;
	}
	public Type getType() {
		return type;
	}
	public String getAttribute() {
		return attribute;
	}
	public String getDescription() {
		return description;
	}
	public String getDefaultValue() {
		return defaultValue;
	}
	public void setDefaultValue(String defaultValue) {
		this.defaultValue = defaultValue;
	}
	public boolean isFlag() {
		return type == Type.FLAG;
	}
	/**
	 * @return String Option as it should be typed, followed by the type of value it expects
	 */
	public String getUsage() {
		if(isFlag()) return "-"+id;
		return "-"+id+" "+type;
	}

	/**
	 * Decodes the given value and assigns it to the program
	 * @param program Object implementing the command
	 * @param value Text given by the user. Ignored for flags
	 * @throws IllegalArgumentException If the value is not valid for this option
	 */
	public void assign(Object program, String value) {
		Method setter = findSetter(program.getClass());
		Object decoded = decode(value, setter.getParameterTypes()[0]);
		try {
			setter.invoke(program, decoded);
		} catch (InvocationTargetException e) {
			Throwable cause = e.getCause();
			if(cause instanceof IllegalArgumentException) throw (IllegalArgumentException)cause;
			throw new RuntimeException("Can not assign value "+value+" to option -"+id, cause);
		} catch (IllegalAccessException e) {
			throw new RuntimeException("Setter of "+attribute+" can not be called for option -"+id, e);
		}
	}

	private Object decode(String value, Class<?> target) {
		switch (type) {
		case SYMBOL:
			return OptionValuesDecoder.decodeSymbol(value, attribute);
		case ENUM:
			return OptionValuesDecoder.decodeEnum(value, target);
		case FLAG:
			return Boolean.TRUE;
		default:
			return value;
		}
	}

	/**
	 * Finds the public setter of the attribute receiving the parameter type of this option
	 * @param programClass Class implementing the command
	 * @return Method setter to call
	 * @throws IllegalStateException If the class does not have a suitable setter
	 */
	Method findSetter(Class<?> programClass) {
		String name = "set"+Character.toUpperCase(attribute.charAt(0))+attribute.substring(1);
		for(Method method:programClass.getMethods()) {
			if(!method.getName().equals(name) || method.getParameterCount()!=1) continue;
			if(accepts(method.getParameterTypes()[0])) return method;
		}
		throw new IllegalStateException("Class "+programClass.getName()+" does not have a setter "+name+" for option -"+id+" of type "+type);
	}

	private boolean accepts(Class<?> parameterType) {
		switch (type) {
		case FILE:
			return parameterType == String.class;
		case SYMBOL:
			return parameterType == char.class;
		case ENUM:
			return parameterType.isEnum();
		case FLAG:
			return parameterType == boolean.class;
		default:
			return false;
		}
	}
}
