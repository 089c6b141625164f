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
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Program that can be called from the command line with a set of options
 */
public class Command {
	private final String id;
	private final Class<?> program;
	private final String intro;
	private final String description;
	private final Map<String, CommandOption> options = new LinkedHashMap<>();

	public Command(String id, Class<?> program, String intro, String description) {
		this.id = id;
		this.program = program;
		this.intro = intro;
		this.description = description;
	}
	public String getId() {
		return id;
	}
	public Class<?> getProgram() {
		return program;
	}
	public String getIntro() {
		return intro;
	}
	public String getDescription() {
		return description;
	}
	public void addOption(CommandOption option) {
		if(options.containsKey(option.getId())) throw new IllegalStateException("Duplicated option -"+option.getId()+" for command "+id);
		options.put(option.getId(), option);
	}
	public CommandOption getOption(String optionId) {
		return options.get(optionId);
	}
	public List<CommandOption> getOptions() {
		return new ArrayList<>(options.values());
	}

	/**
	 * Calls the main method of the program with the given arguments
	 * @param args Options of the command
	 * @throws Exception Any exception thrown by the program
	 */
	public void execute(String [] args) throws Exception {
		Method main = program.getMethod("main", String[].class);
		try {
			main.invoke(null, (Object)args);
		} catch (InvocationTargetException e) {
			Throwable cause = e.getCause();
			if(cause instanceof Exception) throw (Exception)cause;
			throw e;
		}
	}
}
