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

import java.io.InputStream;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import javax.xml.parsers.DocumentBuilderFactory;

import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;

/**
 * Commands available in BWTSearch, loaded from an XML resource. Each command element names
 * the class implementing it and the options it accepts
 */
public class CommandsDescriptor {
	public static final String RESOURCE = "/bwtsearch/main/CommandsDescriptor.xml";

	private static final CommandsDescriptor instance = new CommandsDescriptor(RESOURCE);

	private final String version;
	private final String releaseDate;
	private final Map<String,Command> commandsById = new LinkedHashMap<>();
	private final Map<Class<?>,Command> commandsByProgram = new HashMap<>();

	private CommandsDescriptor(String resource) {
		Element root = parse(resource).getDocumentElement();
		version = getRequiredAttribute(root, "version");
		releaseDate = getRequiredAttribute(root, "date");
		NodeList commandElems = root.getElementsByTagName("command");
		for(int i=0;i<commandElems.getLength();i++) {
			Command command = loadCommand((Element)commandElems.item(i));
			if(commandsById.containsKey(command.getId())) throw new IllegalStateException("Duplicated command id: "+command.getId());
			commandsById.put(command.getId(), command);
			commandsByProgram.put(command.getProgram(), command);
		}
	}

	public static CommandsDescriptor getInstance() {
		return instance;
	}

	private static Document parse(String resource) {
		try (InputStream is = CommandsDescriptor.class.getResourceAsStream(resource)) {
			if(is==null) throw new IllegalStateException("Resource "+resource+" not found");
			return DocumentBuilderFactory.newInstance().newDocumentBuilder().parse(is);
		} catch (IllegalStateException e) {
			throw e;
		} catch (Exception e) {
			throw new IllegalStateException("Can not load commands from "+resource, e);
		}
	}

	private Command loadCommand(Element elem) {
		String id = getRequiredAttribute(elem, "id");
		String className = getRequiredAttribute(elem, "class");
		Class<?> program;
		try {
			program = Class.forName(className);
			program.getMethod("main", String[].class);
		} catch (ClassNotFoundException | NoSuchMethodException e) {
			throw new IllegalStateException("Class "+className+" for command "+id+" not found or without main method", e);
		}
		Command command = new Command(id, program, getChildText(elem, "intro"), getChildText(elem, "description"));
		NodeList optionElems = elem.getElementsByTagName("option");
		for(int i=0;i<optionElems.getLength();i++) {
			Element optionElem = (Element)optionElems.item(i);
			CommandOption.Type type = CommandOption.Type.valueOf(getRequiredAttribute(optionElem, "type"));
			CommandOption option = new CommandOption(getRequiredAttribute(optionElem, "id"), type, getRequiredAttribute(optionElem, "attribute"), normalize(optionElem.getTextContent()));
			String defaultValue = optionElem.getAttribute("default");
			if(!defaultValue.isEmpty()) option.setDefaultValue(defaultValue);
			//Fails early if the program can not receive the option
			option.findSetter(program);
			command.addOption(option);
		}
		return command;
	}

	private static String getRequiredAttribute(Element elem, String name) {
		String value = elem.getAttribute(name);
		if(value.isEmpty()) throw new IllegalStateException("Element "+elem.getTagName()+" does not have attribute "+name);
		return value;
	}

	private static String getChildText(Element elem, String tagName) {
		NodeList children = elem.getElementsByTagName(tagName);
		if(children.getLength()==0) return "";
		return normalize(children.item(0).getTextContent());
	}

	private static String normalize(String text) {
		return text.trim().replaceAll("\\s+", " ");
	}

	public String getVersion() {
		return version;
	}
	public String getReleaseDate() {
		return releaseDate;
	}
	public Command getCommand(String id) {
		return commandsById.get(id);
	}
	public Command getCommand(Class<?> program) {
		return commandsByProgram.get(program);
	}
	public List<Command> getCommands() {
		return new ArrayList<>(commandsById.values());
	}

	public void printUsage(PrintStream out) {
		out.println("BWTSearch "+version+" - Wildcard substring search over Burrows-Wheeler indexes");
		out.println();
		out.println("USAGE: java -jar BWTSearch_"+version+".jar <COMMAND> <OPTIONS>");
		out.println();
		out.println("Commands:");
		for(Command command:commandsById.values()) {
			out.println(String.format("  %-12s %s", command.getId(), command.getIntro()));
		}
		out.println();
	}

	public void printHelp(Command command, PrintStream out) {
		out.println(command.getId()+": "+command.getIntro());
		out.println();
		out.println(command.getDescription());
		out.println();
		out.println("USAGE: java -jar BWTSearch_"+version+".jar "+command.getId()+" <OPTIONS>");
		out.println();
		out.println("Options:");
		for(CommandOption option:command.getOptions()) {
			String line = String.format("  %-10s %s", option.getUsage(), option.getDescription());
			if(option.getDefaultValue()!=null) line+=" Default: "+option.getDefaultValue();
			out.println(line);
		}
		out.println();
	}

	/**
	 * Assigns the options given in the arguments to the program implementing a command
	 * @param program Object implementing a registered command
	 * @param args Options given by the user
	 * @return boolean false if no options were given or help was requested. In that case the
	 * help of the command is printed to standard error
	 * @throws IllegalArgumentException If an option is unknown, lacks its value or has an invalid value
	 */
	public boolean configure(Object program, String [] args) {
		Command command = commandsByProgram.get(program.getClass());
		if(command==null) throw new IllegalStateException("Class "+program.getClass().getName()+" is not registered as a command");
		if(args.length==0 || (args.length==1 && ("-h".equals(args[0]) || "--help".equals(args[0])))) {
			printHelp(command, System.err);
			return false;
		}
		int i=0;
		while(i<args.length) {
			String arg = args[i];
			if(arg.length()<2 || arg.charAt(0)!='-') throw new IllegalArgumentException("Unexpected argument "+arg+" for command "+command.getId());
			CommandOption option = command.getOption(arg.substring(1));
			if(option==null) throw new IllegalArgumentException("Unrecognized option "+arg+" for command "+command.getId());
			String value = null;
			if(!option.isFlag()) {
				i++;
				if(i==args.length) throw new IllegalArgumentException("Missing value for option "+arg);
				value = args[i];
			}
			option.assign(program, value);
			i++;
		}
		return true;
	}
}
