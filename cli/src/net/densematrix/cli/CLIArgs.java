/*
 * Copyright Myrrix Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package net.densematrix.cli;

import java.util.List;

import com.lexicalscope.jewel.cli.Option;
import com.lexicalscope.jewel.cli.Unparsed;

/**
 * Command line argument object for {@link CLI}.
 *
 * @since 1.0
 */
public interface CLIArgs {

  @Option(description = "Verbose logging")
  boolean isVerbose();

  @Option(defaultToNull = true, description = "Seed for the values made by the random command")
  Long getSeed();

  @Option(helpRequest = true)
  boolean getHelp();

  @Unparsed
  List<String> getCommands();

}
