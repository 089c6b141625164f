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
package bwtsearch;

import java.util.Arrays;

import bwtsearch.main.Command;
import bwtsearch.main.CommandsDescriptor;

/**
 * Entry point. The first argument selects the command and the rest are its options
 */
public class BWTSearch {

	public static void main(String[] args) throws Exception {
		CommandsDescriptor descriptor = CommandsDescriptor.getInstance();
		if(args.length == 0 || isOneOf(args[0], "help", "-h", "--help")) {
			descriptor.printUsage(System.err);
			return;
		}
		if(isOneOf(args[0], "version", "-v", "--version")) {
			System.err.println("BWTSearch version "+descriptor.getVersion()+" ("+descriptor.getReleaseDate()+")");
			return;
		}
		Command command = descriptor.getCommand(args[0]);
		if(command == null) {
			System.err.println("ERROR: Unrecognized command "+args[0]);
			descriptor.printUsage(System.err);
			System.exit(1);
		}
		try {
			command.execute(Arrays.copyOfRange(args, 1, args.length));
		} catch (IllegalArgumentException e) {
			System.err.println("ERROR: "+e.getMessage());
			System.err.println();
			descriptor.printHelp(command, System.err);
			System.exit(1);
		}
	}

	private static boolean isOneOf(String arg, String... values) {
		return Arrays.asList(values).contains(arg);
	}
}
